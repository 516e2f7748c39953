package com.jumbo.companion.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Context a template needs before it may be used. Unknown requirement keys are rejected at load time.
 */
public enum ContextRequirement {
    PREFERRED_NAME("preferred_name") {
        @Override
        public boolean isSatisfiedBy(UserContext context, List<String> mentionedNames) {
            return context.name().isPresent();
        }
    },
    RECENT_MEMORY("recent_memory") {
        @Override
        public boolean isSatisfiedBy(UserContext context, List<String> mentionedNames) {
            return context.relevantMemories().stream()
                    .anyMatch(memory -> memory.content() != null && !memory.content().isBlank());
        }
    },
    KEY_RELATIONSHIPS("key_relationships") {
        @Override
        public boolean isSatisfiedBy(UserContext context, List<String> mentionedNames) {
            return !context.keyRelationships().isEmpty();
        }
    },
    MENTIONED_RELATIONSHIP("mentioned_relationship") {
        @Override
        public boolean isSatisfiedBy(UserContext context, List<String> mentionedNames) {
            return mentionedNames.stream().anyMatch(name -> context.relationshipOf(name).isPresent());
        }
    },
    RECENT_EMOTIONS("recent_emotions") {
        @Override
        public boolean isSatisfiedBy(UserContext context, List<String> mentionedNames) {
            return !context.recentEmotions().isEmpty();
        }
    };

    private final String key;

    ContextRequirement(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public abstract boolean isSatisfiedBy(UserContext context, List<String> mentionedNames);

    public static Optional<ContextRequirement> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalised = key.trim().toLowerCase(Locale.ROOT);
        if ("user_name".equals(normalised)) {
            return Optional.of(PREFERRED_NAME);
        }
        for (ContextRequirement requirement : values()) {
            if (requirement.key.equals(normalised)) {
                return Optional.of(requirement);
            }
        }
        return Optional.empty();
    }
}
