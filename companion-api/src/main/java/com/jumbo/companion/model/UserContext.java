package com.jumbo.companion.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session view of a user, merged from the session cache and bounded store reads.
 * Instances are immutable; every {@code with*} method returns a bounded copy.
 */
public record UserContext(
        String userId,
        String sessionId,
        String preferredName,
        List<String> recentEmotions,
        Map<String, String> keyRelationships,
        List<ConversationMessage> recentMessages,
        List<MemoryRecord> relevantMemories,
        Map<String, Object> preferences,
        Map<String, Object> sessionMetadata
) {

    public static final int MAX_RECENT_EMOTIONS = 5;
    public static final int MAX_RECENT_MESSAGES = 5;
    public static final int MAX_RELEVANT_MEMORIES = 5;
    public static final int MAX_RELATIONSHIPS = 20;
    public static final String MESSAGE_COUNT = "message_count";
    public static final String STARTED_AT = "started_at";

    public UserContext {
        recentEmotions = List.copyOf(tail(recentEmotions, MAX_RECENT_EMOTIONS));
        recentMessages = List.copyOf(tail(recentMessages, MAX_RECENT_MESSAGES));
        relevantMemories = List.copyOf(head(relevantMemories, MAX_RELEVANT_MEMORIES));
        keyRelationships = boundedRelationships(keyRelationships);
        preferences = preferences == null ? Map.of() : Map.copyOf(withoutNullValues(preferences));
        sessionMetadata = sessionMetadata == null ? Map.of() : Map.copyOf(withoutNullValues(sessionMetadata));
    }

    public static UserContext empty(String userId, String sessionId) {
        return new UserContext(userId, sessionId, null, List.of(), Map.of(), List.of(), List.of(), Map.of(), Map.of());
    }

    public Optional<String> name() {
        return preferredName == null || preferredName.isBlank() ? Optional.empty() : Optional.of(preferredName.trim());
    }

    public boolean knowsPerson(String name) {
        return relationshipOf(name).isPresent()
                || relevantMemories.stream().anyMatch(memory -> memory.subjectName() != null
                && memory.subjectName().equalsIgnoreCase(name));
    }

    public boolean knowsRelationshipTerm(String term) {
        return keyRelationships.values().stream().anyMatch(value -> value.equalsIgnoreCase(term));
    }

    public Optional<String> relationshipOf(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return keyRelationships.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public UserContext withPreferences(String preferredName, Map<String, Object> preferences) {
        return new UserContext(userId, sessionId, preferredName, recentEmotions, keyRelationships, recentMessages,
                relevantMemories, preferences, sessionMetadata);
    }

    public UserContext withRelationships(Map<String, String> additions) {
        Map<String, String> merged = new LinkedHashMap<>(keyRelationships);
        additions.forEach(merged::putIfAbsent);
        return new UserContext(userId, sessionId, preferredName, recentEmotions, merged, recentMessages,
                relevantMemories, preferences, sessionMetadata);
    }

    public UserContext withRecentMessages(List<ConversationMessage> messages, List<String> emotions) {
        return new UserContext(userId, sessionId, preferredName, emotions, keyRelationships, messages,
                relevantMemories, preferences, sessionMetadata);
    }

    /**
     * Places the given memories ahead of the ones already known, dropping duplicates by id.
     */
    public UserContext withMemories(Collection<MemoryRecord> memories) {
        Map<String, MemoryRecord> merged = new LinkedHashMap<>();
        memories.forEach(memory -> merged.putIfAbsent(memory.id(), memory));
        relevantMemories.forEach(memory -> merged.putIfAbsent(memory.id(), memory));
        return new UserContext(userId, sessionId, preferredName, recentEmotions, keyRelationships, recentMessages,
                new ArrayList<>(merged.values()), preferences, sessionMetadata);
    }

    /**
     * Appends the incoming message; the oldest message and emotion are evicted first.
     */
    public UserContext withIncomingMessage(ConversationMessage message) {
        List<ConversationMessage> messages = new ArrayList<>(recentMessages);
        messages.add(message);
        List<String> emotions = new ArrayList<>(recentEmotions);
        if (message.emotion() != null && message.emotion() != Emotion.NEUTRAL) {
            emotions.add(message.emotion().tag());
        }
        return withRecentMessages(messages, emotions);
    }

    /**
     * Messages seen in this session, including the current one once it has been appended.
     */
    public int messageCount() {
        Object count = sessionMetadata.get(MESSAGE_COUNT);
        return count instanceof Number number ? number.intValue() : 0;
    }

    public UserContext withSessionMetadata(String key, Object value) {
        Map<String, Object> metadata = new LinkedHashMap<>(sessionMetadata);
        metadata.put(key, value);
        return new UserContext(userId, sessionId, preferredName, recentEmotions, keyRelationships, recentMessages,
                relevantMemories, preferences, metadata);
    }

    private static <T> List<T> tail(List<T> values, int max) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.size() <= max ? values : values.subList(values.size() - max, values.size());
    }

    private static <T> List<T> head(List<T> values, int max) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.size() <= max ? values : values.subList(0, max);
    }

    private static Map<String, String> boundedRelationships(Map<String, String> relationships) {
        if (relationships == null || relationships.isEmpty()) {
            return Map.of();
        }
        Map<String, String> bounded = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : relationships.entrySet()) {
            if (bounded.size() >= MAX_RELATIONSHIPS) {
                break;
            }
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                continue;
            }
            String relationship = entry.getValue() == null ? "friend" : entry.getValue().toLowerCase(Locale.ROOT);
            bounded.put(entry.getKey(), relationship);
        }
        return Collections.unmodifiableMap(bounded);
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
