package com.jumbo.companion.service;

import com.jumbo.companion.model.ChatReply;
import com.jumbo.companion.model.Degradation;
import com.jumbo.companion.model.FallbackReason;
import com.jumbo.companion.model.GovernorState;
import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.ResponseMetadata;
import com.jumbo.companion.model.ResponseStrategy;
import com.jumbo.companion.model.UserContext;
import com.jumbo.companion.service.analysis.MessageAnalyzer;
import com.jumbo.companion.service.context.ContextExtractor;
import com.jumbo.companion.service.context.ContextResult;
import com.jumbo.companion.service.fallback.FallbackResponder;
import com.jumbo.companion.service.governor.MemoryProbe;
import com.jumbo.companion.service.governor.ResourceGovernor;
import com.jumbo.companion.service.llm.ExternalServiceUnavailableException;
import com.jumbo.companion.service.llm.GuardedLlmService;
import com.jumbo.companion.service.personalization.PersonalizedText;
import com.jumbo.companion.service.personalization.Personalizer;
import com.jumbo.companion.service.strategy.StrategyDecision;
import com.jumbo.companion.service.strategy.StrategySelector;
import com.jumbo.companion.service.template.TemplateChoice;
import com.jumbo.companion.service.template.TemplateSelector;
import com.jumbo.companion.service.template.UsageTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The response decision pipeline. Usage history, governor outcome and metrics are only updated once the
 * strategy and the response text of a turn are final.
 */
@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);
    private static final String TURNS_METRIC = "companion.turns";
    private static final String LATENCY_METRIC = "companion.turn.latency";
    private static final String FALLBACK_METRIC = "companion.fallbacks";

    private final MessageAnalyzer analyzer;
    private final ContextExtractor contextExtractor;
    private final StrategySelector strategySelector;
    private final TemplateSelector templateSelector;
    private final UsageTracker usageTracker;
    private final Personalizer personalizer;
    private final FallbackResponder fallbackResponder;
    private final GuardedLlmService llmService;
    private final ResourceGovernor governor;
    private final MemoryProbe memoryProbe;
    private final UserTurnLocks turnLocks;
    private final MeterRegistry meterRegistry;

    public DefaultChatService(MessageAnalyzer analyzer,
                              ContextExtractor contextExtractor,
                              StrategySelector strategySelector,
                              TemplateSelector templateSelector,
                              UsageTracker usageTracker,
                              Personalizer personalizer,
                              FallbackResponder fallbackResponder,
                              GuardedLlmService llmService,
                              ResourceGovernor governor,
                              MemoryProbe memoryProbe,
                              UserTurnLocks turnLocks,
                              MeterRegistry meterRegistry) {
        this.analyzer = analyzer;
        this.contextExtractor = contextExtractor;
        this.strategySelector = strategySelector;
        this.templateSelector = templateSelector;
        this.usageTracker = usageTracker;
        this.personalizer = personalizer;
        this.fallbackResponder = fallbackResponder;
        this.llmService = llmService;
        this.governor = governor;
        this.memoryProbe = memoryProbe;
        this.turnLocks = turnLocks;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public ChatReply respond(String userId, String message, String sessionId) {
        long started = System.nanoTime();
        long heapBefore = memoryProbe.usedBytes();
        Optional<ReentrantLock> lock = turnLocks.acquire(userId);
        if (lock.isEmpty()) {
            // Not a pipeline outcome; nothing is recorded with the governor.
            log.warn("Turn lock for user {} not acquired in time, answering with overload", userId);
            MessageAnalysis analysis = analyzer.analyze(message);
            String text = fallbackResponder.respond(FallbackReason.OVERLOAD, analysis.emotion(), null, userId,
                    usageTracker.snapshot(userId).turnIndex());
            Turn turn = Turn.fallback(FallbackReason.OVERLOAD, text, 0, List.of());
            return reply(analysis, turn, System.nanoTime() - started);
        }
        try {
            return decide(userId, message, sessionId, started, heapBefore);
        } finally {
            lock.get().unlock();
        }
    }

    private ChatReply decide(String userId, String message, String sessionId, long started, long heapBefore) {
        MessageAnalysis analysis = MessageAnalysis.neutral(message);
        Turn turn;
        boolean errored = false;
        try {
            analysis = analyzer.analyze(message);
            turn = decideTurn(userId, sessionId, analysis);
            // commit point
            if (turn.choice() != null) {
                templateSelector.commit(userId, turn.choice(), turn.followUpUsed());
            } else {
                usageTracker.recordTurn(userId);
            }
        } catch (RuntimeException ex) {
            log.error("Turn for user {} failed, answering with the generic message", userId, ex);
            String text = fallbackResponder.respond(FallbackReason.INTERNAL_ERROR, analysis.emotion(), null, userId, 0);
            turn = Turn.fallback(FallbackReason.INTERNAL_ERROR, text, 0, List.of());
            errored = true;
        }
        long elapsedNanos = System.nanoTime() - started;
        governor.recordOutcome(Duration.ofNanos(elapsedNanos), memoryProbe.usedBytes() - heapBefore, errored);
        return reply(analysis, turn, elapsedNanos);
    }

    private Turn decideTurn(String userId, String sessionId, MessageAnalysis analysis) {
        Set<Degradation> degradations = new LinkedHashSet<>();
        if (analysis.degraded()) {
            degradations.add(Degradation.ANALYSIS_DEGRADED);
        }
        GovernorState governorState = governor.state();
        ContextResult contextResult = contextExtractor.getContext(userId, sessionId, analysis, governorState);
        degradations.addAll(contextResult.degradations());
        UserContext context = contextResult.context();
        UsageTracker.Snapshot usage = usageTracker.snapshot(userId);

        StrategyDecision decision = strategySelector.select(analysis, context, governorState, userId,
                contextResult.storeUnavailable());
        degradations.addAll(decision.degradations());

        return switch (decision.strategy().kind()) {
            case TEMPLATE -> templateTurn(decision.choice().orElseThrow(), analysis, context, usage, userId,
                    contextResult.storeReads(), degradations);
            case LLM -> llmTurn(analysis, context, usage, userId, contextResult.storeReads(), degradations);
            case FALLBACK -> {
                FallbackReason reason = ((ResponseStrategy.Fallback) decision.strategy()).reason();
                String text = fallbackResponder.respond(reason, analysis.emotion(), context, userId,
                        usage.turnIndex());
                yield Turn.fallback(reason, text, contextResult.storeReads(), degradations);
            }
        };
    }

    private Turn templateTurn(TemplateChoice choice,
                              MessageAnalysis analysis,
                              UserContext context,
                              UsageTracker.Snapshot usage,
                              String userId,
                              int storeReads,
                              Set<Degradation> degradations) {
        int followUpCursor = usage.followUpCursor(choice.templateId());
        PersonalizedText personalized = personalizer.personalize(choice.template(), choice.text(), context,
                analysis.mentionedNames(), followUpCursor);
        if (personalized.text().isBlank()) {
            log.debug("Variation {} of template {} left nothing, trying its base text", choice.variationIndex(),
                    choice.templateId());
            personalized = personalizer.personalize(choice.template(), choice.template().baseText(), context,
                    analysis.mentionedNames(), followUpCursor);
        }
        if (personalized.text().isBlank()) {
            log.warn("Template {} personalized to empty text for user {}", choice.templateId(), userId);
            degradations.add(Degradation.NO_QUALIFYING_TEMPLATE);
            String text = fallbackResponder.respond(FallbackReason.NO_TEMPLATE, analysis.emotion(), context, userId,
                    usage.turnIndex());
            return Turn.fallback(FallbackReason.NO_TEMPLATE, text, storeReads, degradations);
        }
        return new Turn(ResponseStrategy.template(choice.templateId()), personalized.text(), choice,
                personalized.followUpUsed(), personalized.memoriesUsed(), storeReads, List.copyOf(degradations));
    }

    private Turn llmTurn(MessageAnalysis analysis,
                         UserContext context,
                         UsageTracker.Snapshot usage,
                         String userId,
                         int storeReads,
                         Set<Degradation> degradations) {
        try {
            String text = llmService.respond(analysis, context);
            return new Turn(ResponseStrategy.llm(), text, null, false, 0, storeReads, List.copyOf(degradations));
        } catch (ExternalServiceUnavailableException ex) {
            degradations.add(Degradation.EXTERNAL_SERVICE_UNAVAILABLE);
            String text = fallbackResponder.respond(FallbackReason.LLM_UNAVAILABLE, analysis.emotion(), context,
                    userId, usage.turnIndex());
            return Turn.fallback(FallbackReason.LLM_UNAVAILABLE, text, storeReads, degradations);
        }
    }

    private ChatReply reply(MessageAnalysis analysis, Turn turn, long elapsedNanos) {
        Duration latency = Duration.ofNanos(elapsedNanos);
        ResponseStrategy strategy = turn.strategy();
        String strategyTag = strategy.kind().name().toLowerCase(Locale.ROOT);
        meterRegistry.counter(TURNS_METRIC, "strategy", strategyTag).increment();
        meterRegistry.timer(LATENCY_METRIC, "strategy", strategyTag).record(elapsedNanos, TimeUnit.NANOSECONDS);
        FallbackReason reason = strategy instanceof ResponseStrategy.Fallback fallback ? fallback.reason() : null;
        if (reason != null) {
            meterRegistry.counter(FALLBACK_METRIC, "reason", reason.name().toLowerCase(Locale.ROOT)).increment();
        }

        ResponseMetadata metadata = new ResponseMetadata(
                strategy.kind(),
                reason,
                analysis.emotion(),
                analysis.emotionConfidence(),
                analysis.intent(),
                turn.choice() == null ? null : turn.choice().templateId(),
                turn.memoriesUsed(),
                turn.storeReads(),
                latency.toMillis(),
                turn.degradations()
        );
        log.debug("Answered with {} in {} ms", strategy, metadata.latencyMs());
        return new ChatReply(turn.text(), metadata);
    }

    private record Turn(ResponseStrategy strategy,
                        String text,
                        TemplateChoice choice,
                        boolean followUpUsed,
                        int memoriesUsed,
                        int storeReads,
                        List<Degradation> degradations) {

        static Turn fallback(FallbackReason reason, String text, int storeReads, Iterable<Degradation> degradations) {
            List<Degradation> copy = new ArrayList<>();
            degradations.forEach(copy::add);
            return new Turn(ResponseStrategy.fallback(reason), text, null, false, 0, storeReads, List.copyOf(copy));
        }
    }
}
