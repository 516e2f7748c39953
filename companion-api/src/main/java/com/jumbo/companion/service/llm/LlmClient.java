package com.jumbo.companion.service.llm;

public interface LlmClient {

    /**
     * Returns the completion text, possibly blank. Transport failures are thrown.
     */
    String complete(LlmPrompt prompt);
}
