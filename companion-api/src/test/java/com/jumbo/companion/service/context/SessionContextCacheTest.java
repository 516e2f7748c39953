package com.jumbo.companion.service.context;

import com.github.benmanes.caffeine.cache.Ticker;
import com.jumbo.companion.model.UserContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class SessionContextCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private final SessionContextCache cache = new SessionContextCache(Duration.ofMinutes(30), 2, ticker);

    @Test
    void returnsContextForSameSession() {
        cache.put(UserContext.empty("u1", "s1").withPreferences("Sam", null));

        assertThat(cache.get("u1", "s1")).get()
                .extracting(UserContext::preferredName)
                .isEqualTo("Sam");
    }

    @Test
    void differentSessionIsAMissAndDropsTheEntry() {
        cache.put(UserContext.empty("u1", "s1"));

        assertThat(cache.get("u1", "s2")).isEmpty();
        assertThat(cache.get("u1", "s1")).isEmpty();
    }

    @Test
    void entriesExpireAfterTheSessionLength() {
        cache.put(UserContext.empty("u1", "s1"));

        nanos.addAndGet(Duration.ofMinutes(29).toNanos());
        assertThat(cache.get("u1", "s1")).isPresent();

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(cache.get("u1", "s1")).isEmpty();
    }

    @Test
    void sizeIsBounded() {
        cache.put(UserContext.empty("u1", "s1"));
        cache.put(UserContext.empty("u2", "s1"));
        cache.put(UserContext.empty("u3", "s1"));
        cache.sweep();

        assertThat(cache.size()).isLessThanOrEqualTo(2);
    }
}
