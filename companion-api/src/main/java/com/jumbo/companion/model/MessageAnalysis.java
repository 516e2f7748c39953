package com.jumbo.companion.model;

import java.util.List;
import java.util.Set;

public record MessageAnalysis(
        String rawText,
        Emotion emotion,
        double emotionConfidence,
        Intent intent,
        List<Entity> entities,
        Set<String> contextTriggers,
        double complexityScore,
        Set<String> topics,
        boolean crisis,
        boolean degraded
) {

    public MessageAnalysis {
        entities = entities == null ? List.of() : List.copyOf(entities);
        contextTriggers = contextTriggers == null ? Set.of() : Set.copyOf(contextTriggers);
        topics = topics == null ? Set.of() : Set.copyOf(topics);
        emotion = emotion == null ? Emotion.NEUTRAL : emotion;
        intent = intent == null ? Intent.CASUAL_CHAT : intent;
        emotionConfidence = Math.max(0.0, Math.min(1.0, emotionConfidence));
    }

    /**
     * Analysis used when the text is empty or could not be classified.
     */
    public static MessageAnalysis neutral(String rawText) {
        return new MessageAnalysis(rawText == null ? "" : rawText, Emotion.NEUTRAL, 0.0, Intent.CASUAL_CHAT,
                List.of(), Set.of(), 0.0, Set.of(), false, false);
    }

    /**
     * Neutral analysis flagged as degraded, used when the analyzer itself failed.
     */
    public static MessageAnalysis degraded(String rawText) {
        return new MessageAnalysis(rawText == null ? "" : rawText, Emotion.NEUTRAL, 0.0, Intent.CASUAL_CHAT,
                List.of(), Set.of(), 0.0, Set.of(), false, true);
    }

    public List<String> mentionedNames() {
        return entities.stream()
                .filter(entity -> entity.type() == EntityType.PERSON_NAME)
                .map(Entity::text)
                .distinct()
                .toList();
    }
}
