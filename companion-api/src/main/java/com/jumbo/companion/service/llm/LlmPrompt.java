package com.jumbo.companion.service.llm;

public record LlmPrompt(String systemPrompt, String userPrompt) {
}
