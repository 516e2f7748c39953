package com.jumbo.companion.service.strategy;

import com.jumbo.companion.model.Degradation;
import com.jumbo.companion.model.ResponseStrategy;
import com.jumbo.companion.service.template.TemplateChoice;

import java.util.List;
import java.util.Optional;

public record StrategyDecision(ResponseStrategy strategy, TemplateChoice templateChoice, List<Degradation> degradations) {

    public StrategyDecision {
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
    }

    public Optional<TemplateChoice> choice() {
        return Optional.ofNullable(templateChoice);
    }
}
