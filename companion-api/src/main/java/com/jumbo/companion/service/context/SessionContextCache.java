package com.jumbo.companion.service.context;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.jumbo.companion.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-user context for the current session. An entry belongs to one session id; a lookup with another
 * session id is a miss. Entries expire one session length after their last write.
 */
@Component
public class SessionContextCache {

    private static final Logger log = LoggerFactory.getLogger(SessionContextCache.class);

    private final Cache<String, UserContext> contexts;

    @Autowired
    public SessionContextCache(@Value("${companion.session.ttl-minutes:30}") long ttlMinutes,
                               @Value("${companion.session.max-entries:10000}") long maxEntries) {
        this(Duration.ofMinutes(Math.max(1, ttlMinutes)), maxEntries, Ticker.systemTicker());
    }

    SessionContextCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.contexts = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(Math.max(1, maxEntries))
                .ticker(ticker)
                .build();
    }

    public Optional<UserContext> get(String userId, String sessionId) {
        UserContext context = contexts.getIfPresent(userId);
        if (context == null) {
            return Optional.empty();
        }
        if (!context.sessionId().equals(sessionId)) {
            log.debug("Session changed for user {}, discarding cached context", userId);
            contexts.invalidate(userId);
            return Optional.empty();
        }
        return Optional.of(context);
    }

    public void put(UserContext context) {
        contexts.put(context.userId(), context);
    }

    public void invalidate(String userId) {
        contexts.invalidate(userId);
    }

    public long size() {
        contexts.cleanUp();
        return contexts.estimatedSize();
    }

    @Scheduled(fixedDelayString = "${companion.session.sweep-interval-ms:60000}")
    public void sweep() {
        contexts.cleanUp();
    }
}
