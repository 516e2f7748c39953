package com.jumbo.companion.service.memory;

import com.jumbo.companion.model.MemoryRecord;
import com.jumbo.companion.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed profile and memory store for local runs without a database.
 */
@Component
@Profile("inmemory")
public class InMemoryMemoryStore implements MemoryStore, UserProfileStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, List<MemoryRecord>> memories = new ConcurrentHashMap<>();

    public void saveProfile(UserProfile profile) {
        profiles.put(profile.userId(), profile);
    }

    public void addMemory(String userId, MemoryRecord memory) {
        memories.compute(userId, (key, existing) -> {
            List<MemoryRecord> records = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            records.add(memory);
            return records;
        });
        log.debug("Stored {} memory {} for user {}", memory.kind(), memory.id(), userId);
    }

    @Override
    public Optional<UserProfile> getPreferences(String userId) {
        return Optional.ofNullable(profiles.get(userId));
    }

    @Override
    public List<MemoryRecord> getRecentMemories(String userId, int limit) {
        return memories.getOrDefault(userId, List.of()).stream()
                .sorted(Comparator.comparing(MemoryRecord::createdAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<MemoryRecord> searchMemories(String userId, Collection<String> keywords, int limit) {
        List<String> lowered = keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
        return memories.getOrDefault(userId, List.of()).stream()
                .filter(memory -> lowered.stream().anyMatch(keyword -> mentions(memory, keyword)))
                .sorted(Comparator.comparing(MemoryRecord::createdAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    private static boolean mentions(MemoryRecord memory, String keyword) {
        return (memory.content() != null && memory.content().toLowerCase(Locale.ROOT).contains(keyword))
                || (memory.subjectName() != null && memory.subjectName().equalsIgnoreCase(keyword));
    }
}
