package com.jumbo.companion.service.governor;

import com.jumbo.companion.model.GovernorState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResourceGovernorTest {

    private static final Duration FAST = Duration.ofMillis(20);

    private final MemoryProbe memoryProbe = mock(MemoryProbe.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T09:00:00Z"));
    private final CircuitBreaker llmBreaker = CircuitBreaker.ofDefaults("llm");
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private ResourceGovernor governor;

    @BeforeEach
    void setUp() {
        when(memoryProbe.usedBytes()).thenReturn(100L);
        when(memoryProbe.maxBytes()).thenReturn(1_000L);
        governor = governor(true);
    }

    @Test
    void healthyTrafficKeepsCircuitClosed() {
        for (int i = 0; i < 10; i++) {
            governor.recordOutcome(FAST, 0, false);
        }

        assertThat(governor.state()).isEqualTo(GovernorState.healthy(true));
        assertThat(governor.windowSize()).isEqualTo(4);
    }

    @Test
    void errorRateOpensCircuitAndClearsWindow() {
        governor.recordOutcome(FAST, 0, true);
        assertThat(governor.isOpen()).isFalse();

        governor.recordOutcome(FAST, 0, true);

        assertThat(governor.state()).isEqualTo(GovernorState.open());
        assertThat(governor.windowSize()).isZero();
        assertThat(meterRegistry.get("companion.governor.open").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void slowTurnsOpenCircuit() {
        governor.recordOutcome(Duration.ofMillis(1_500), 0, false);
        governor.recordOutcome(Duration.ofMillis(900), 0, false);

        assertThat(governor.isOpen()).isTrue();
    }

    @Test
    void heapAboveCeilingOpensImmediately() {
        when(memoryProbe.usedBytes()).thenReturn(950L);

        governor.recordOutcome(FAST, 0, false);

        assertThat(governor.isOpen()).isTrue();
    }

    @Test
    void closesAfterCooldownWithoutBreach() {
        governor.recordOutcome(FAST, 0, true);
        governor.recordOutcome(FAST, 0, true);

        clock.advance(Duration.ofSeconds(29));
        assertThat(governor.isOpen()).isTrue();

        clock.advance(Duration.ofSeconds(2));
        assertThat(governor.state()).isEqualTo(GovernorState.healthy(true));
    }

    @Test
    void breachWhileOpenExtendsCooldown() {
        governor.recordOutcome(FAST, 0, true);
        governor.recordOutcome(FAST, 0, true);

        clock.advance(Duration.ofSeconds(20));
        governor.recordOutcome(FAST, 0, true);
        clock.advance(Duration.ofSeconds(11));
        assertThat(governor.isOpen()).isTrue();

        clock.advance(Duration.ofSeconds(20));
        assertThat(governor.isOpen()).isFalse();
    }

    @Test
    void openLlmBreakerDisallowsLlm() {
        llmBreaker.transitionToOpenState();

        assertThat(governor.state()).isEqualTo(GovernorState.healthy(false));
    }

    @Test
    void disabledLlmIsNeverAllowed() {
        assertThat(governor(false).state().allowLlm()).isFalse();
    }

    @Test
    void healthReportsDegradedWhileOpen() {
        GovernorHealthIndicator indicator = new GovernorHealthIndicator(governor);
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);

        governor.recordOutcome(FAST, 0, true);
        governor.recordOutcome(FAST, 0, true);

        assertThat(indicator.health().getStatus()).isEqualTo(GovernorHealthIndicator.DEGRADED);
        assertThat(indicator.health().getDetails()).containsEntry("circuit", "open");
    }

    private ResourceGovernor governor(boolean llmEnabled) {
        GovernorProperties properties = new GovernorProperties(4, 2, 0.5, Duration.ofMillis(1_000), 0.9,
                Duration.ofSeconds(30), llmEnabled);
        return new ResourceGovernor(properties, memoryProbe, clock, llmBreaker, meterRegistry);
    }
}
