package com.jumbo.companion.service.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Used when no LLM endpoint is configured. Returns nothing, so every LLM turn falls back.
 */
@Component
@Profile("offline")
public class NoopLlmClient implements LlmClient {

    @Override
    public String complete(LlmPrompt prompt) {
        return "";
    }
}
