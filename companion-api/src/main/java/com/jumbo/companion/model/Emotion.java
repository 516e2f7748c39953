package com.jumbo.companion.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Emotion categories recognised by the analyzer, declared in support-urgency order.
 * The declaration order is the tie-break priority: earlier constants win.
 */
public enum Emotion {
    SADNESS,
    ANXIETY,
    ANGER,
    HAPPINESS,
    NEUTRAL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Emotion> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalised = tag.trim().toLowerCase(Locale.ROOT);
        for (Emotion emotion : values()) {
            if (emotion.tag().equals(normalised)) {
                return Optional.of(emotion);
            }
        }
        return switch (normalised) {
            case "sad", "lonely", "tired" -> Optional.of(SADNESS);
            case "anxious", "worried" -> Optional.of(ANXIETY);
            case "angry", "frustrated" -> Optional.of(ANGER);
            case "happy", "excited" -> Optional.of(HAPPINESS);
            default -> Optional.empty();
        };
    }
}
