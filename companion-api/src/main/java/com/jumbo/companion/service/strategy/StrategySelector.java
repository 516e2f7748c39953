package com.jumbo.companion.service.strategy;

import com.jumbo.companion.model.Degradation;
import com.jumbo.companion.model.FallbackReason;
import com.jumbo.companion.model.GovernorState;
import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.ResponseStrategy;
import com.jumbo.companion.model.UserContext;
import com.jumbo.companion.service.template.TemplateChoice;
import com.jumbo.companion.service.template.TemplateSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decides how a turn is answered. Rules are checked in order: overload, crisis, store outage, qualifying
 * template, LLM for complex messages, then a no-template fallback.
 */
@Component
public class StrategySelector {

    private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

    private final TemplateSelector templateSelector;
    private final double complexityThreshold;

    public StrategySelector(TemplateSelector templateSelector,
                            @Value("${companion.strategy.llm-complexity-threshold:0.7}") double complexityThreshold) {
        this.templateSelector = templateSelector;
        this.complexityThreshold = complexityThreshold;
    }

    public StrategyDecision select(MessageAnalysis analysis, UserContext context, GovernorState governorState, String userId) {
        return select(analysis, context, governorState, userId, false);
    }

    /**
     * @param storeUnavailable no cached context and every store read issued this turn failed
     */
    public StrategyDecision select(MessageAnalysis analysis,
                                   UserContext context,
                                   GovernorState governorState,
                                   String userId,
                                   boolean storeUnavailable) {
        if (governorState.circuitOpen()) {
            return fallback(FallbackReason.OVERLOAD, List.of());
        }
        if (analysis.crisis()) {
            log.warn("Crisis language detected for user {}", userId);
            return fallback(FallbackReason.CRISIS, List.of());
        }
        if (storeUnavailable) {
            log.warn("All store reads failed for user {}, answering with a static fallback", userId);
            return fallback(FallbackReason.STORE_UNAVAILABLE, List.of(Degradation.EXTERNAL_SERVICE_UNAVAILABLE));
        }
        Optional<TemplateChoice> choice = templateSelector.choose(analysis, context, userId);
        if (choice.isPresent()) {
            return new StrategyDecision(ResponseStrategy.template(choice.get().templateId()), choice.get(), List.of());
        }
        if (analysis.complexityScore() > complexityThreshold && governorState.allowLlm()) {
            log.debug("No template for user {} and complexity {} above {}, using LLM", userId,
                    analysis.complexityScore(), complexityThreshold);
            return new StrategyDecision(ResponseStrategy.llm(), null, List.of(Degradation.NO_QUALIFYING_TEMPLATE));
        }
        return fallback(FallbackReason.NO_TEMPLATE, List.of(Degradation.NO_QUALIFYING_TEMPLATE));
    }

    private static StrategyDecision fallback(FallbackReason reason, List<Degradation> degradations) {
        return new StrategyDecision(ResponseStrategy.fallback(reason), null, degradations);
    }
}
