package com.jumbo.companion.service.governor;

import com.jumbo.companion.model.GovernorState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

@Component
public class GovernorHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Answering with overload fallbacks");

    private final ResourceGovernor governor;

    public GovernorHealthIndicator(ResourceGovernor governor) {
        this.governor = governor;
    }

    @Override
    public Health health() {
        GovernorState state = governor.state();
        Health.Builder builder = state.circuitOpen() ? Health.status(DEGRADED) : Health.up();
        return builder
                .withDetail("circuit", state.circuitOpen() ? "open" : "closed")
                .withDetail("allowLlm", state.allowLlm())
                .build();
    }
}
