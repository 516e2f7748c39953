package com.jumbo.companion.service.template;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.ResponseTemplate;
import com.jumbo.companion.model.Tone;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VariationPickerTest {

    private final VariationPicker picker = new VariationPicker();
    private final ResponseTemplate template = new ResponseTemplate("t", "casual_chat", Set.of(Emotion.NEUTRAL),
            "Base.", List.of("One.", "Two.", "Three.", "Four."), List.of(), Set.of(), Tone.CALMING, 1.0);

    @Test
    void sameUserAndTurnPicksTheSameVariation() {
        assertThat(picker.pick(template, "u1", 7)).isEqualTo(picker.pick(template, "u1", 7));
    }

    @Test
    void picksStayInRangeAndVaryAcrossTurns() {
        Set<Integer> seen = new HashSet<>();
        for (int turn = 0; turn < 50; turn++) {
            int index = picker.pick(template, "u1", turn);
            assertThat(index).isBetween(0, 3);
            seen.add(index);
        }

        assertThat(seen).hasSizeGreaterThan(1);
    }
}
