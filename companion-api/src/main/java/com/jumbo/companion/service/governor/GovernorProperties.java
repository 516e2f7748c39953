package com.jumbo.companion.service.governor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Thresholds of the resource governor's count-based outcome window.
 *
 * @param windowSize          number of recent turns kept
 * @param minimumCalls        outcomes required before rate and latency thresholds apply
 * @param errorRateThreshold  error share in the window that opens the circuit
 * @param latencyThreshold    average latency in the window that opens the circuit
 * @param memoryCeilingRatio  used heap as a share of max heap that opens the circuit
 * @param cooldown            time without a breach after which an open circuit closes
 * @param llmEnabled          whether external LLM calls are permitted at all
 */
@ConfigurationProperties(prefix = "companion.governor")
public record GovernorProperties(
        @DefaultValue("20") int windowSize,
        @DefaultValue("5") int minimumCalls,
        @DefaultValue("0.5") double errorRateThreshold,
        @DefaultValue("1500ms") Duration latencyThreshold,
        @DefaultValue("0.9") double memoryCeilingRatio,
        @DefaultValue("30s") Duration cooldown,
        @DefaultValue("true") boolean llmEnabled
) {

    public GovernorProperties {
        windowSize = Math.max(1, windowSize);
        minimumCalls = Math.max(1, Math.min(windowSize, minimumCalls));
    }

    public static GovernorProperties defaults() {
        return new GovernorProperties(20, 5, 0.5, Duration.ofMillis(1500), 0.9, Duration.ofSeconds(30), true);
    }
}
