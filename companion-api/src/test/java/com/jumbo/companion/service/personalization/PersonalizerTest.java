package com.jumbo.companion.service.personalization;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.MemoryKind;
import com.jumbo.companion.model.MemoryRecord;
import com.jumbo.companion.model.ResponseTemplate;
import com.jumbo.companion.model.Tone;
import com.jumbo.companion.model.UserContext;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PersonalizerTest {

    private final Personalizer personalizer = new Personalizer();
    private final UserContext anonymous = UserContext.empty("u1", "s1");

    @Test
    void fillsPreferredName() {
        PersonalizedText result = personalizer.personalize("[NAME], I'm really sorry you're feeling low.",
                anonymous.withPreferences("Sam", null), List.of());

        assertThat(result.text()).isEqualTo("Sam, I'm really sorry you're feeling low.");
        assertThat(result.memoriesUsed()).isZero();
    }

    @Test
    void dropsClauseWithUnknownName() {
        assertThat(personalizer.personalize("[NAME], I'm really sorry you're feeling low.", anonymous, List.of()).text())
                .isEqualTo("I'm really sorry you're feeling low.");
        assertThat(personalizer.personalize("I hear you, [NAME]. It's okay to not be okay.", anonymous, List.of()).text())
                .isEqualTo("I hear you. It's okay to not be okay.");
    }

    @Test
    void dropsSentenceWithoutMemory() {
        PersonalizedText result = personalizer.personalize(
                "Last time you mentioned that [MEMORY]. Is that still on your mind?", anonymous, List.of());

        assertThat(result.text()).isEqualTo("Is that still on your mind?");
        assertThat(result.memoriesUsed()).isZero();
    }

    @Test
    void fillsMemoryAndCountsIt() {
        UserContext context = anonymous.withMemories(List.of(new MemoryRecord("m1", MemoryKind.FACT,
                "you started a new job.", null, null, null, OffsetDateTime.now())));

        PersonalizedText result = personalizer.personalize(
                "Last time you mentioned that [MEMORY]. Is that still on your mind?", context, List.of());

        assertThat(result.text()).isEqualTo("Last time you mentioned that you started a new job. Is that still on your mind?");
        assertThat(result.memoriesUsed()).isEqualTo(1);
    }

    @Test
    void friendNamePrefersTheMentionedPerson() {
        Map<String, String> relationships = new LinkedHashMap<>();
        relationships.put("Priya", "friend");
        relationships.put("Arjun", "brother");
        UserContext context = anonymous.withRelationships(relationships);

        assertThat(personalizer.personalize("It's kind of you to think about [FRIEND_NAME].", context, List.of("Arjun")))
                .isEqualTo(new PersonalizedText("It's kind of you to think about Arjun.", 1, false));
        assertThat(personalizer.personalize("It's kind of you to think about [FRIEND_NAME].", context, List.of()).text())
                .isEqualTo("It's kind of you to think about Priya.");
    }

    @Test
    void unresolvableTextBecomesEmpty() {
        assertThat(personalizer.personalize("[NAME]!", anonymous, List.of()).text()).isEmpty();
    }

    @Test
    void appendsFollowUpAtCursor() {
        ResponseTemplate template = template(List.of("I'm here."), List.of("How are you sleeping?", "What helps?"));

        PersonalizedText result = personalizer.personalize(template, "I'm here.", anonymous, List.of(), 3);

        assertThat(result.text()).isEqualTo("I'm here. What helps?");
        assertThat(result.followUpUsed()).isTrue();
    }

    @Test
    void skipsFollowUpWhenTextAlreadyAsks() {
        ResponseTemplate template = template(List.of("Want to talk?"), List.of("What helps?"));

        PersonalizedText result = personalizer.personalize(template, "Want to talk?", anonymous, List.of(), 0);

        assertThat(result.text()).isEqualTo("Want to talk?");
        assertThat(result.followUpUsed()).isFalse();
    }

    private static ResponseTemplate template(List<String> variations, List<String> questions) {
        return new ResponseTemplate("t", "emotional_support", Set.of(Emotion.SADNESS), "Base.", variations, questions,
                Set.of(), Tone.GENTLE, 1.0);
    }
}
