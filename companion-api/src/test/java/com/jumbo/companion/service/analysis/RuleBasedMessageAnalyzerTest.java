package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.EntityType;
import com.jumbo.companion.model.Intent;
import com.jumbo.companion.model.MessageAnalysis;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RuleBasedMessageAnalyzerTest {

    private final RuleBasedMessageAnalyzer analyzer = new RuleBasedMessageAnalyzer();

    @Test
    void detectsSadnessWithIntensifier() {
        MessageAnalysis analysis = analyzer.analyze("I'm feeling really sad today");

        assertThat(analysis.emotion()).isEqualTo(Emotion.SADNESS);
        assertThat(analysis.emotionConfidence()).isCloseTo(0.8, within(0.0001));
        assertThat(analysis.intent()).isEqualTo(Intent.EMOTIONAL_SUPPORT);
        assertThat(analysis.crisis()).isFalse();
        assertThat(analysis.degraded()).isFalse();
    }

    @Test
    void negatedKeywordDoesNotCount() {
        MessageAnalysis analysis = analyzer.analyze("I'm not sad at all");

        assertThat(analysis.emotion()).isEqualTo(Emotion.NEUTRAL);
        assertThat(analysis.emotionConfidence()).isZero();
        assertThat(analysis.intent()).isEqualTo(Intent.CASUAL_CHAT);
    }

    @Test
    void extractsNameIntroducedByRelationship() {
        MessageAnalysis analysis = analyzer.analyze("My friend Priya has been distant lately");

        assertThat(analysis.entities())
                .anySatisfy(entity -> {
                    assertThat(entity.text()).isEqualTo("Priya");
                    assertThat(entity.type()).isEqualTo(EntityType.PERSON_NAME);
                    assertThat(entity.relationship()).isEqualTo("friend");
                    assertThat(entity.confidence()).isEqualTo(EntityExtractor.CUE_CONFIDENCE);
                });
        assertThat(analysis.mentionedNames()).containsExactly("Priya");
        assertThat(analysis.contextTriggers()).contains("Priya", "friend");
    }

    @Test
    void askingAfterSomeoneIsMemoryRecall() {
        MessageAnalysis analysis = analyzer.analyze("How is Priya doing?");

        assertThat(analysis.intent()).isEqualTo(Intent.MEMORY_RECALL);
        assertThat(analysis.emotion()).isEqualTo(Emotion.NEUTRAL);
        assertThat(analysis.mentionedNames()).containsExactly("Priya");
        assertThat(analysis.contextTriggers()).containsExactly("Priya");
    }

    @Test
    void recallWithoutEntitiesUsesContentKeywords() {
        MessageAnalysis analysis = analyzer.analyze("Do you remember what I told you about the exam?");

        assertThat(analysis.intent()).isEqualTo(Intent.MEMORY_RECALL);
        assertThat(analysis.entities()).isEmpty();
        assertThat(analysis.contextTriggers()).containsExactly("exam");
        assertThat(analysis.topics()).contains("school");
    }

    @Test
    void recognisesGreeting() {
        assertThat(analyzer.analyze("Hello there").intent()).isEqualTo(Intent.GREETING);
    }

    @Test
    void flagsCrisisLanguage() {
        MessageAnalysis analysis = analyzer.analyze("Some days I just want to die");

        assertThat(analysis.crisis()).isTrue();
    }

    @Test
    void blankInputIsNeutral() {
        assertThat(analyzer.analyze("   ").emotion()).isEqualTo(Emotion.NEUTRAL);
        assertThat(analyzer.analyze(null).rawText()).isEmpty();
    }

    @Test
    void analyzerFailureDegradesToNeutral() {
        EmotionRuleTable failing = mock(EmotionRuleTable.class);
        when(failing.score(any())).thenThrow(new IllegalStateException("rule table unavailable"));

        MessageAnalysis analysis = new RuleBasedMessageAnalyzer(failing).analyze("I'm so angry");

        assertThat(analysis.degraded()).isTrue();
        assertThat(analysis.emotion()).isEqualTo(Emotion.NEUTRAL);
        assertThat(analysis.rawText()).isEqualTo("I'm so angry");
    }

    @Test
    void complexityGrowsWithLengthQuestionsAndTopics() {
        String simple = "ok";
        String rich = "My boss keeps adding deadlines at work, my mom is sick, rent is due and I can't sleep. "
                + "What should I do? How do I tell my family? Is it normal to feel like this?";

        double low = RuleBasedMessageAnalyzer.complexity(simple, Tokens.of(simple), Set.of());
        double high = analyzer.analyze(rich).complexityScore();

        assertThat(low).isLessThan(0.05);
        assertThat(high).isGreaterThan(0.7).isLessThanOrEqualTo(1.0);
    }
}
