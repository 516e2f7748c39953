package com.jumbo.companion.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes turns of the same user. Locks are weakly held, so an idle user's lock is reclaimed once no
 * turn references it.
 */
@Component
public class UserTurnLocks {

    private static final Logger log = LoggerFactory.getLogger(UserTurnLocks.class);

    private final LoadingCache<String, ReentrantLock> locks;
    private final Duration timeout;

    public UserTurnLocks(@Value("${companion.turn.lock-timeout-ms:2000}") long timeoutMs) {
        this.locks = Caffeine.newBuilder()
                .weakValues()
                .build(userId -> new ReentrantLock());
        this.timeout = Duration.ofMillis(Math.max(1, timeoutMs));
    }

    /**
     * The held lock, or empty when it could not be acquired in time. Callers unlock the returned lock.
     */
    public Optional<ReentrantLock> acquire(String userId) {
        ReentrantLock lock = locks.get(userId);
        try {
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Optional.of(lock);
            }
            log.warn("Timed out after {} waiting for the turn lock of user {}", timeout, userId);
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
