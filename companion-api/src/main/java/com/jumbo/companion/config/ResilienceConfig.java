package com.jumbo.companion.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreaker llmCircuitBreaker(@Value("${companion.llm.breaker.failure-rate:50}") float failureRate,
                                            @Value("${companion.llm.breaker.window:20}") int window,
                                            @Value("${companion.llm.breaker.open-seconds:30}") long openSeconds) {
        var cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRate)
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(window)
                .minimumNumberOfCalls(Math.min(window, 5))
                .waitDurationInOpenState(Duration.ofSeconds(openSeconds))
                .build();
        return CircuitBreaker.of("llm", cfg);
    }

    @Bean
    public TimeLimiter storeTimeLimiter(@Value("${companion.context.read-timeout-ms:250}") long timeoutMs) {
        // upper bound for a single profile or memory read
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(Math.max(1, timeoutMs)))
                .cancelRunningFuture(true)
                .build());
    }
}
