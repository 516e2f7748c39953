package com.jumbo.companion.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseMetadata(
        StrategyKind strategy,
        FallbackReason fallbackReason,
        Emotion emotion,
        double confidence,
        Intent intent,
        String templateId,
        int memoriesUsed,
        int storeReads,
        long latencyMs,
        List<Degradation> degradations
) {

    public ResponseMetadata {
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
    }
}
