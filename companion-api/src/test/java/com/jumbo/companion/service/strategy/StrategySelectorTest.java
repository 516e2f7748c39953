package com.jumbo.companion.service.strategy;

import com.jumbo.companion.model.Degradation;
import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.FallbackReason;
import com.jumbo.companion.model.GovernorState;
import com.jumbo.companion.model.Intent;
import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.ResponseStrategy;
import com.jumbo.companion.model.ResponseTemplate;
import com.jumbo.companion.model.StrategyKind;
import com.jumbo.companion.model.Tone;
import com.jumbo.companion.model.UserContext;
import com.jumbo.companion.service.template.TemplateChoice;
import com.jumbo.companion.service.template.TemplateSelector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StrategySelectorTest {

    private final TemplateSelector templateSelector = mock(TemplateSelector.class);
    private final StrategySelector selector = new StrategySelector(templateSelector, 0.7);
    private final UserContext context = UserContext.empty("u1", "s1");

    @Test
    void openCircuitAlwaysAnswersWithOverload() {
        StrategyDecision decision = selector.select(analysis(0.9, true), context, GovernorState.open(), "u1");

        assertThat(decision.strategy()).isEqualTo(ResponseStrategy.fallback(FallbackReason.OVERLOAD));
        verifyNoInteractions(templateSelector);
    }

    @Test
    void crisisBypassesTemplatesAndLlm() {
        StrategyDecision decision = selector.select(analysis(0.9, true), context, GovernorState.healthy(true), "u1");

        assertThat(decision.strategy()).isEqualTo(ResponseStrategy.fallback(FallbackReason.CRISIS));
        verifyNoInteractions(templateSelector);
    }

    @Test
    void storeOutageFallsBackBeforeTemplates() {
        StrategyDecision decision = selector.select(analysis(0.1, false), context, GovernorState.healthy(true), "u1", true);

        assertThat(decision.strategy()).isEqualTo(ResponseStrategy.fallback(FallbackReason.STORE_UNAVAILABLE));
        assertThat(decision.degradations()).containsExactly(Degradation.EXTERNAL_SERVICE_UNAVAILABLE);
    }

    @Test
    void qualifyingTemplateWins() {
        TemplateChoice choice = new TemplateChoice(template(), 0, 1.0, 0, false);
        when(templateSelector.choose(any(), any(), anyString())).thenReturn(Optional.of(choice));

        StrategyDecision decision = selector.select(analysis(0.9, false), context, GovernorState.healthy(true), "u1");

        assertThat(decision.strategy()).isEqualTo(ResponseStrategy.template("sad_plain"));
        assertThat(decision.choice()).contains(choice);
        assertThat(decision.degradations()).isEmpty();
    }

    @Test
    void complexMessageWithoutTemplateUsesLlm() {
        when(templateSelector.choose(any(), any(), anyString())).thenReturn(Optional.empty());

        StrategyDecision decision = selector.select(analysis(0.9, false), context, GovernorState.healthy(true), "u1");

        assertThat(decision.strategy().kind()).isEqualTo(StrategyKind.LLM);
        assertThat(decision.degradations()).containsExactly(Degradation.NO_QUALIFYING_TEMPLATE);
    }

    @Test
    void llmIsNotUsedWhenGovernorDisallowsIt() {
        when(templateSelector.choose(any(), any(), anyString())).thenReturn(Optional.empty());

        StrategyDecision decision = selector.select(analysis(0.9, false), context, GovernorState.healthy(false), "u1");

        assertThat(decision.strategy()).isEqualTo(ResponseStrategy.fallback(FallbackReason.NO_TEMPLATE));
    }

    @Test
    void simpleMessageWithoutTemplateFallsBack() {
        when(templateSelector.choose(any(), any(), anyString())).thenReturn(Optional.empty());

        StrategyDecision decision = selector.select(analysis(0.7, false), context, GovernorState.healthy(true), "u1");

        assertThat(decision.strategy()).isEqualTo(ResponseStrategy.fallback(FallbackReason.NO_TEMPLATE));
        assertThat(decision.degradations()).containsExactly(Degradation.NO_QUALIFYING_TEMPLATE);
    }

    private static MessageAnalysis analysis(double complexity, boolean crisis) {
        return new MessageAnalysis("text", Emotion.SADNESS, 0.8, Intent.EMOTIONAL_SUPPORT, List.of(), Set.of(),
                complexity, Set.of(), crisis, false);
    }

    private static ResponseTemplate template() {
        return new ResponseTemplate("sad_plain", "emotional_support", Set.of(Emotion.SADNESS), "Base.",
                List.of("I'm here."), List.of(), Set.of(), Tone.EMPATHETIC, 1.0);
    }
}
