package com.jumbo.companion.model;

public record GovernorState(boolean circuitOpen, boolean allowLlm) {

    public static GovernorState healthy(boolean llmAvailable) {
        return new GovernorState(false, llmAvailable);
    }

    public static GovernorState open() {
        return new GovernorState(true, false);
    }
}
