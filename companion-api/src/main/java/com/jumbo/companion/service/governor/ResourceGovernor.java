package com.jumbo.companion.service.governor;

import com.jumbo.companion.model.GovernorState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Process-wide circuit over recent turn outcomes. While open every turn is answered with an overload
 * fallback and no store reads are issued. The outcome window is cleared whenever the circuit opens.
 */
@Component
public class ResourceGovernor {

    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    private final GovernorProperties properties;
    private final MemoryProbe memoryProbe;
    private final Clock clock;
    private final CircuitBreaker llmCircuitBreaker;
    private final DistributionSummary memoryDelta;
    private final Deque<Outcome> window = new ArrayDeque<>();

    private volatile boolean open;
    private Instant lastBreach;

    public ResourceGovernor(GovernorProperties properties,
                            MemoryProbe memoryProbe,
                            Clock clock,
                            @Qualifier("llmCircuitBreaker") CircuitBreaker llmCircuitBreaker,
                            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.memoryProbe = memoryProbe;
        this.clock = clock;
        this.llmCircuitBreaker = llmCircuitBreaker;
        this.memoryDelta = DistributionSummary.builder("companion.governor.memory.delta")
                .baseUnit("bytes")
                .register(meterRegistry);
        meterRegistry.gauge("companion.governor.open", this, governor -> governor.open ? 1 : 0);
    }

    public synchronized void recordOutcome(Duration latency, long memoryDeltaBytes, boolean errored) {
        memoryDelta.record(Math.max(0, memoryDeltaBytes));
        Instant now = clock.instant();
        if (open) {
            if (errored || latency.compareTo(properties.latencyThreshold()) >= 0 || heapAboveCeiling()) {
                lastBreach = now;
            }
            return;
        }
        window.addLast(new Outcome(latency.toMillis(), errored));
        while (window.size() > properties.windowSize()) {
            window.removeFirst();
        }
        String reason = breachReason();
        if (reason != null) {
            trip(now, reason);
        }
    }

    public synchronized GovernorState state() {
        if (open) {
            Instant now = clock.instant();
            if (heapAboveCeiling()) {
                lastBreach = now;
            } else if (Duration.between(lastBreach, now).compareTo(properties.cooldown()) >= 0) {
                open = false;
                log.info("Resource governor closed after {} without a breach", properties.cooldown());
            }
        }
        if (open) {
            return GovernorState.open();
        }
        return GovernorState.healthy(properties.llmEnabled() && llmCallsPermitted());
    }

    public boolean isOpen() {
        return state().circuitOpen();
    }

    synchronized int windowSize() {
        return window.size();
    }

    private boolean llmCallsPermitted() {
        CircuitBreaker.State state = llmCircuitBreaker.getState();
        return state != CircuitBreaker.State.OPEN && state != CircuitBreaker.State.FORCED_OPEN;
    }

    private String breachReason() {
        if (heapAboveCeiling()) {
            return "heap above ceiling";
        }
        if (window.size() < properties.minimumCalls()) {
            return null;
        }
        long errors = window.stream().filter(Outcome::errored).count();
        double errorRate = (double) errors / window.size();
        if (errorRate >= properties.errorRateThreshold()) {
            return String.format("error rate %.2f", errorRate);
        }
        double averageLatency = window.stream().mapToLong(Outcome::latencyMs).average().orElse(0);
        if (averageLatency >= properties.latencyThreshold().toMillis()) {
            return String.format("average latency %.0f ms", averageLatency);
        }
        return null;
    }

    private boolean heapAboveCeiling() {
        long max = memoryProbe.maxBytes();
        return max > 0 && memoryProbe.usedBytes() >= max * properties.memoryCeilingRatio();
    }

    private void trip(Instant now, String reason) {
        open = true;
        lastBreach = now;
        window.clear();
        log.warn("Resource governor opened: {}", reason);
    }

    private record Outcome(long latencyMs, boolean errored) {
    }
}
