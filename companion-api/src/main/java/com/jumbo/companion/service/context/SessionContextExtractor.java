package com.jumbo.companion.service.context;

import com.jumbo.companion.model.ConversationMessage;
import com.jumbo.companion.model.Degradation;
import com.jumbo.companion.model.Entity;
import com.jumbo.companion.model.EntityType;
import com.jumbo.companion.model.GovernorState;
import com.jumbo.companion.model.MemoryRecord;
import com.jumbo.companion.model.MessageAnalysis;
import com.jumbo.companion.model.UserContext;
import com.jumbo.companion.model.UserProfile;
import com.jumbo.companion.service.memory.MemoryStore;
import com.jumbo.companion.service.memory.UserProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

@Service
public class SessionContextExtractor implements ContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(SessionContextExtractor.class);
    private static final String DEFAULT_RELATIONSHIP = "friend";

    private final SessionContextCache cache;
    private final UserProfileStore profileStore;
    private final MemoryStore memoryStore;
    private final StoreReadExecutor readExecutor;
    private final Clock clock;
    private final int maxReads;
    private final int recentMemoryLimit;
    private final int searchLimit;

    public SessionContextExtractor(SessionContextCache cache,
                                   UserProfileStore profileStore,
                                   MemoryStore memoryStore,
                                   StoreReadExecutor readExecutor,
                                   Clock clock,
                                   @Value("${companion.context.max-reads:3}") int maxReads,
                                   @Value("${companion.context.recent-memories:5}") int recentMemoryLimit,
                                   @Value("${companion.context.search-limit:5}") int searchLimit) {
        this.cache = cache;
        this.profileStore = profileStore;
        this.memoryStore = memoryStore;
        this.readExecutor = readExecutor;
        this.clock = clock;
        this.maxReads = Math.max(0, Math.min(QueryBudget.HARD_LIMIT, maxReads));
        this.recentMemoryLimit = Math.max(1, recentMemoryLimit);
        this.searchLimit = Math.max(1, searchLimit);
    }

    @Override
    public ContextResult getContext(String userId, String sessionId, MessageAnalysis analysis, GovernorState governorState) {
        QueryBudget budget = new QueryBudget(governorState.circuitOpen() ? 0 : maxReads);
        Set<Degradation> degradations = new LinkedHashSet<>();
        AtomicInteger failures = new AtomicInteger();
        Optional<UserContext> cached = Optional.empty();
        UserContext context = UserContext.empty(userId, sessionId);
        try {
            cached = cache.get(userId, sessionId);
            context = cached.orElse(context);

            if (cached.isEmpty()) {
                context = readPreferences(userId, context, budget, degradations, failures);
                context = readRecentMemories(userId, context, budget, degradations, failures);
            }
            Set<String> unknown = unknownTriggers(analysis, context);
            if (!unknown.isEmpty()) {
                context = searchMemories(userId, unknown, context, budget, degradations, failures);
            }
        } catch (RuntimeException ex) {
            log.error("Context extraction failed for user {}, continuing with partial context", userId, ex);
            degradations.add(Degradation.CONTEXT_READ_FAILED);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        context = context.withIncomingMessage(new ConversationMessage(analysis.rawText(), analysis.emotion(), now))
                .withSessionMetadata(UserContext.MESSAGE_COUNT, context.messageCount() + 1);
        if (!context.sessionMetadata().containsKey(UserContext.STARTED_AT)) {
            context = context.withSessionMetadata(UserContext.STARTED_AT, now.toString());
        }
        cache.put(context);
        log.debug("Context for user {} built with {} store reads (cache {})", userId, budget.used(),
                cached.isPresent() ? "hit" : "miss");
        return new ContextResult(context, budget.used(), failures.get(), cached.isPresent(), new ArrayList<>(degradations));
    }

    private UserContext readPreferences(String userId, UserContext context, QueryBudget budget,
                                        Set<Degradation> degradations, AtomicInteger failures) {
        Optional<ReadOutcome<Optional<UserProfile>>> outcome = read("preferences", budget, degradations, failures,
                () -> profileStore.getPreferences(userId));
        if (outcome.isEmpty()) {
            return context;
        }
        Optional<UserProfile> profile = outcome.get().result().flatMap(value -> value);
        if (profile.isEmpty()) {
            return context;
        }
        return context
                .withPreferences(profile.get().preferredName(), profile.get().preferences())
                .withRelationships(profile.get().keyRelationships());
    }

    private UserContext readRecentMemories(String userId, UserContext context, QueryBudget budget,
                                           Set<Degradation> degradations, AtomicInteger failures) {
        return read("recent-memories", budget, degradations, failures,
                () -> memoryStore.getRecentMemories(userId, recentMemoryLimit))
                .flatMap(ReadOutcome::result)
                .map(memories -> mergeMemories(context, memories))
                .orElse(context);
    }

    private UserContext searchMemories(String userId, Set<String> keywords, UserContext context, QueryBudget budget,
                                       Set<Degradation> degradations, AtomicInteger failures) {
        return read("memory-search", budget, degradations, failures,
                () -> memoryStore.searchMemories(userId, keywords, searchLimit))
                .flatMap(ReadOutcome::result)
                .map(memories -> mergeMemories(context, memories))
                .orElse(context);
    }

    /**
     * Empty when the read did not fit the budget.
     */
    private <T> Optional<ReadOutcome<T>> read(String name, QueryBudget budget, Set<Degradation> degradations,
                                              AtomicInteger failures, Supplier<T> supplier) {
        if (!budget.tryAcquire()) {
            log.debug("Skipping store read {}: budget exhausted", name);
            degradations.add(Degradation.BUDGET_EXCEEDED);
            return Optional.empty();
        }
        ReadOutcome<T> outcome = readExecutor.read(name, supplier);
        if (outcome.failed()) {
            failures.incrementAndGet();
            degradations.add(Degradation.CONTEXT_READ_FAILED);
        }
        return Optional.of(outcome);
    }

    private static UserContext mergeMemories(UserContext context, Collection<MemoryRecord> memories) {
        Map<String, String> people = new LinkedHashMap<>();
        for (MemoryRecord memory : memories) {
            if (memory.describesPerson()) {
                people.putIfAbsent(memory.subjectName(),
                        memory.relationship() == null ? DEFAULT_RELATIONSHIP : memory.relationship());
            }
        }
        return context.withMemories(memories).withRelationships(people);
    }

    /**
     * Triggers the context cannot answer yet: unknown people, unknown relationship terms and recall keywords
     * that no known memory mentions.
     */
    static Set<String> unknownTriggers(MessageAnalysis analysis, UserContext context) {
        Map<String, EntityType> typed = new LinkedHashMap<>();
        for (Entity entity : analysis.entities()) {
            String trigger = entity.type() == EntityType.PERSON_NAME ? entity.text() : entity.relationship();
            typed.putIfAbsent(trigger, entity.type());
        }
        Set<String> unknown = new LinkedHashSet<>();
        for (String trigger : analysis.contextTriggers()) {
            EntityType type = typed.get(trigger);
            boolean known;
            if (type == EntityType.PERSON_NAME) {
                known = context.knowsPerson(trigger);
            } else if (type == EntityType.RELATIONSHIP_TERM) {
                known = context.knowsRelationshipTerm(trigger);
            } else {
                String keyword = trigger.toLowerCase(Locale.ROOT);
                known = context.relevantMemories().stream()
                        .anyMatch(memory -> memory.content() != null
                                && memory.content().toLowerCase(Locale.ROOT).contains(keyword));
            }
            if (!known) {
                unknown.add(trigger);
            }
        }
        return unknown;
    }
}
