package com.jumbo.companion.service.context;

import com.jumbo.companion.model.Degradation;
import com.jumbo.companion.model.UserContext;

import java.util.List;

public record ContextResult(
        UserContext context,
        int storeReads,
        int failedReads,
        boolean cacheHit,
        List<Degradation> degradations
) {

    public ContextResult {
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
    }

    /**
     * True when no cached context existed and every read issued this turn failed. On a cache hit a failed
     * read only degrades the field it was meant to fill.
     */
    public boolean storeUnavailable() {
        return !cacheHit && storeReads > 0 && failedReads == storeReads;
    }
}
