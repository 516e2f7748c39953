package com.jumbo.companion.service.template;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-user template usage: committed turn count, the rolling history of chosen template ids and the
 * follow-up question cursor of each template. Entries are bounded by size and expire after access.
 */
@Component
public class UsageTracker {

    public static final int HISTORY_SIZE = 10;

    private final Cache<String, UserUsage> usage;

    public UsageTracker(@Value("${companion.usage.max-users:10000}") long maxUsers,
                        @Value("${companion.usage.expire-after-access-minutes:120}") long expireMinutes) {
        this.usage = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxUsers))
                .expireAfterAccess(Duration.ofMinutes(Math.max(1, expireMinutes)))
                .build();
    }

    public Snapshot snapshot(String userId) {
        UserUsage entry = usage.getIfPresent(userId);
        return entry == null ? Snapshot.EMPTY : entry.snapshot();
    }

    /**
     * Records a turn answered from a template and advances its follow-up cursor when a question was used.
     */
    public void recordTemplate(String userId, String templateId, boolean followUpUsed) {
        usage.get(userId, key -> new UserUsage()).recordTemplate(templateId, followUpUsed);
    }

    /**
     * Records a turn that was not answered from a template. Only the turn count moves.
     */
    public void recordTurn(String userId) {
        usage.get(userId, key -> new UserUsage()).recordTurn();
    }

    public long trackedUsers() {
        usage.cleanUp();
        return usage.estimatedSize();
    }

    public record Snapshot(int turnIndex, List<String> history, Map<String, Integer> followUpCursors) {

        static final Snapshot EMPTY = new Snapshot(0, List.of(), Map.of());

        public Snapshot {
            history = List.copyOf(history);
            followUpCursors = Map.copyOf(followUpCursors);
        }

        /**
         * The most recent {@code size} template ids, oldest first.
         */
        public List<String> rotationWindow(int size) {
            if (size <= 0 || history.isEmpty()) {
                return List.of();
            }
            return history.subList(Math.max(0, history.size() - size), history.size());
        }

        public int recentUses(String templateId) {
            int count = 0;
            for (String id : history) {
                if (id.equals(templateId)) {
                    count++;
                }
            }
            return count;
        }

        public int followUpCursor(String templateId) {
            return followUpCursors.getOrDefault(templateId, 0);
        }
    }

    private static final class UserUsage {

        private int turnCount;
        private final Deque<String> history = new ArrayDeque<>();
        private final Map<String, Integer> followUpCursors = new HashMap<>();

        synchronized Snapshot snapshot() {
            return new Snapshot(turnCount, new ArrayList<>(history), followUpCursors);
        }

        synchronized void recordTemplate(String templateId, boolean followUpUsed) {
            turnCount++;
            history.addLast(templateId);
            while (history.size() > HISTORY_SIZE) {
                history.removeFirst();
            }
            if (followUpUsed) {
                followUpCursors.merge(templateId, 1, Integer::sum);
            }
        }

        synchronized void recordTurn() {
            turnCount++;
        }
    }
}
