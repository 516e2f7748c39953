package com.jumbo.companion.service.llm;

import com.jumbo.companion.service.llm.openai.OpenAiChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
@Profile("!offline")
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiChatClient chatClient;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public OpenAiLlmClient(OpenAiChatClient chatClient,
                           @Value("${companion.llm.model:gpt-4o-mini}") String model,
                           @Value("${companion.llm.temperature:0.7}") double temperature,
                           @Value("${companion.llm.max-output-tokens:200}") int maxOutputTokens) {
        this.chatClient = chatClient;
        this.model = Objects.requireNonNullElse(model, "gpt-4o-mini");
        this.temperature = temperature;
        this.maxOutputTokens = Math.max(32, maxOutputTokens);
    }

    @Override
    public String complete(LlmPrompt prompt) {
        OpenAiChatClient.Completion completion = chatClient.complete(OpenAiChatClient.CompletionRequest.of(
                model, prompt.systemPrompt(), prompt.userPrompt(), temperature, maxOutputTokens));
        if (completion.usage() != null) {
            log.debug("LLM completion used {} tokens", completion.usage().totalTokens());
        }
        if (completion.truncated()) {
            log.debug("LLM completion hit the {} token limit", maxOutputTokens);
        }
        return completion.content()
                .map(String::trim)
                .orElseGet(() -> {
                    log.warn("LLM completion for model {} returned no choices", model);
                    return "";
                });
    }
}
