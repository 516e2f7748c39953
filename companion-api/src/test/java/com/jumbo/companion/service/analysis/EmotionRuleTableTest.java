package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.Emotion;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmotionRuleTableTest {

    private final EmotionRuleTable table = EmotionRuleTable.defaults();

    @ParameterizedTest
    @CsvSource({
            "I feel sad, SADNESS, 0.6667",
            "I'm extremely sad, SADNESS, 1.0",
            "I'm a bit worried, ANXIETY, 0.4667",
            "so furious right now, ANGER, 1.0",
            "I'm happy and grateful, HAPPINESS, 1.0",
            "the weather is cloudy, NEUTRAL, 0.0"
    })
    void scoresMessages(String message, Emotion expected, double confidence) {
        EmotionRuleTable.Score score = table.score(Tokens.of(message));

        assertThat(score.emotion()).isEqualTo(expected);
        assertThat(score.confidence()).isCloseTo(confidence, within(0.001));
    }

    @Test
    void tiesGoToTheEarlierCategory() {
        EmotionRuleTable.Score score = table.score(Tokens.of("sad and angry"));

        assertThat(score.emotion()).isEqualTo(Emotion.SADNESS);
    }

    @Test
    void strongestModifierWins() {
        EmotionRuleTable.Score score = table.score(Tokens.of("really extremely sad"));

        assertThat(score.confidence()).isCloseTo(1.0, within(0.001));
    }

    @Test
    void contractionNegatesFollowingKeyword() {
        EmotionRuleTable.Score score = table.score(Tokens.of("I don't feel happy, I'm anxious"));

        assertThat(score.emotion()).isEqualTo(Emotion.ANXIETY);
    }

    @Test
    void keywordCountsOnceEvenWhenRepeated() {
        EmotionRuleTable.Score score = table.score(Tokens.of("sad sad sad"));

        assertThat(score.confidence()).isCloseTo(2.0 / 3.0, within(0.001));
    }
}
