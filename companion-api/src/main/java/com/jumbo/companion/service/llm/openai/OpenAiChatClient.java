package com.jumbo.companion.service.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Blocking client for an OpenAI-compatible {@code /v1/chat/completions} endpoint. Error statuses and
 * transport failures both surface as {@link OpenAiChatException}.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);
    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${companion.llm.timeout-seconds:8}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public Completion complete(CompletionRequest request) {
        Completion completion;
        try {
            completion = webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> rejected(response.statusCode(), body)))
                    .bodyToMono(Completion.class)
                    .block(timeout);
        } catch (OpenAiChatException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Chat completion for model {} failed: {}", request.model(), ex.getMessage());
            throw new OpenAiChatException("Chat completion request failed", ex);
        }
        if (completion == null) {
            throw new OpenAiChatException("Chat completion returned an empty body");
        }
        return completion;
    }

    private static OpenAiChatException rejected(HttpStatusCode status, String body) {
        log.warn("Chat completion returned {}: {}", status.value(), body);
        return new OpenAiChatException("Chat completion returned " + status.value(), status.value(), null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CompletionRequest(String model,
                                    List<Message> messages,
                                    Double temperature,
                                    @JsonProperty("max_tokens") Integer maxTokens,
                                    boolean stream) {

        public static CompletionRequest of(String model, String systemPrompt, String userPrompt,
                                           double temperature, int maxTokens) {
            return new CompletionRequest(model,
                    List.of(new Message("system", systemPrompt), new Message("user", userPrompt)),
                    temperature, maxTokens, false);
        }
    }

    public record Message(String role, String content) {
    }

    public record Completion(List<Choice> choices, Usage usage) {

        /**
         * Content of the first choice, if the endpoint returned one.
         */
        public Optional<String> content() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(choices.get(0).message().content());
        }

        /**
         * True when the first choice stopped on the token limit.
         */
        public boolean truncated() {
            return choices != null && !choices.isEmpty() && "length".equals(choices.get(0).finishReason());
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens) {
    }
}
