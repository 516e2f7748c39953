package com.jumbo.companion.service.context;

import com.jumbo.companion.model.GovernorState;
import com.jumbo.companion.model.MessageAnalysis;

public interface ContextExtractor {

    /**
     * Builds the context for a turn from the session cache and at most three store reads, then writes the
     * merged context back including the current message. Never throws.
     */
    ContextResult getContext(String userId, String sessionId, MessageAnalysis analysis, GovernorState governorState);
}
