package com.jumbo.companion.service.llm;

import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.UserContext;
import com.jumbo.companion.service.llm.openai.OpenAiChatException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * LLM access behind the LLM circuit breaker. A failed, rejected or blank completion surfaces as
 * {@link ExternalServiceUnavailableException}.
 */
@Service
public class GuardedLlmService {

    private static final Logger log = LoggerFactory.getLogger(GuardedLlmService.class);

    private final LlmClient llmClient;
    private final LlmPromptBuilder promptBuilder;
    private final CircuitBreaker circuitBreaker;

    public GuardedLlmService(LlmClient llmClient,
                             LlmPromptBuilder promptBuilder,
                             @Qualifier("llmCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.llmClient = llmClient;
        this.promptBuilder = promptBuilder;
        this.circuitBreaker = circuitBreaker;
    }

    public String respond(MessageAnalysis analysis, UserContext context) {
        LlmPrompt prompt = promptBuilder.build(analysis, context);
        try {
            return circuitBreaker.executeSupplier(() -> {
                String answer = llmClient.complete(prompt);
                if (answer == null || answer.isBlank()) {
                    throw new ExternalServiceUnavailableException("LLM returned an empty completion");
                }
                return answer.trim();
            });
        } catch (CallNotPermittedException ex) {
            log.debug("LLM circuit breaker is open, skipping call");
            throw new ExternalServiceUnavailableException("LLM circuit breaker is open", ex);
        } catch (ExternalServiceUnavailableException ex) {
            log.warn("LLM completion unusable: {}", ex.getMessage());
            throw ex;
        } catch (OpenAiChatException ex) {
            if (ex.noResponse()) {
                log.warn("LLM endpoint unreachable: {}", ex.getMessage());
            } else {
                log.warn("LLM endpoint rejected the completion with status {}", ex.status());
            }
            throw new ExternalServiceUnavailableException("LLM completion failed", ex);
        } catch (RuntimeException ex) {
            log.warn("LLM completion failed: {}", ex.getMessage());
            throw new ExternalServiceUnavailableException("LLM completion failed", ex);
        }
    }
}
