package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.Entity;
import com.jumbo.companion.model.EntityType;
import com.jumbo.companion.model.Intent;
import com.jumbo.companion.model.MessageAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class RuleBasedMessageAnalyzer implements MessageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedMessageAnalyzer.class);

    private static final int RECALL_KEYWORDS = 3;
    private static final Set<String> STOP_WORDS = Set.of(
            "about", "remember", "recall", "what", "when", "where", "that", "this", "there", "their", "with",
            "have", "your", "told", "said", "time", "last", "talked", "were", "would", "could", "should",
            "doing", "been", "from", "they", "them", "just", "really");

    private final EmotionRuleTable emotionRules;
    private final IntentClassifier intentClassifier;
    private final EntityExtractor entityExtractor;
    private final TopicDetector topicDetector;
    private final CrisisDetector crisisDetector;

    public RuleBasedMessageAnalyzer() {
        this(EmotionRuleTable.defaults());
    }

    RuleBasedMessageAnalyzer(EmotionRuleTable emotionRules) {
        this.emotionRules = emotionRules;
        this.intentClassifier = new IntentClassifier();
        this.entityExtractor = new EntityExtractor();
        this.topicDetector = new TopicDetector();
        this.crisisDetector = new CrisisDetector();
    }

    @Override
    public MessageAnalysis analyze(String text) {
        if (text == null || text.isBlank()) {
            return MessageAnalysis.neutral(text);
        }
        try {
            Tokens tokens = Tokens.of(text);
            EmotionRuleTable.Score emotion = emotionRules.score(tokens);
            Intent intent = intentClassifier.classify(text, emotion.emotion());
            List<Entity> entities = entityExtractor.extract(text);
            Set<String> topics = topicDetector.detect(tokens);
            boolean crisis = crisisDetector.isCrisis(tokens);
            MessageAnalysis analysis = new MessageAnalysis(
                    text,
                    emotion.emotion(),
                    emotion.confidence(),
                    intent,
                    entities,
                    triggers(intent, entities, tokens),
                    complexity(text, tokens, topics),
                    topics,
                    crisis,
                    false
            );
            log.debug("Analysed message as {} ({}) intent {} with {} entities", analysis.emotion(),
                    analysis.emotionConfidence(), analysis.intent(), analysis.entities().size());
            return analysis;
        } catch (RuntimeException ex) {
            log.warn("Message analysis failed, treating message as neutral: {}", ex.getMessage(), ex);
            return MessageAnalysis.degraded(text);
        }
    }

    private Set<String> triggers(Intent intent, List<Entity> entities, Tokens tokens) {
        Set<String> triggers = new LinkedHashSet<>();
        for (Entity entity : entities) {
            triggers.add(entity.type() == EntityType.PERSON_NAME ? entity.text() : entity.relationship());
        }
        if (triggers.isEmpty() && intent == Intent.MEMORY_RECALL) {
            tokens.words().stream()
                    .filter(word -> word.length() >= 4 && !STOP_WORDS.contains(word) && !word.contains("'"))
                    .distinct()
                    .limit(RECALL_KEYWORDS)
                    .forEach(triggers::add);
        }
        return triggers;
    }

    static double complexity(String text, Tokens tokens, Set<String> topics) {
        long questions = text.chars().filter(c -> c == '?').count();
        double score = 0.5 * Math.min(1.0, tokens.size() / 60.0)
                + 0.2 * Math.min(1.0, questions / 3.0)
                + 0.3 * Math.min(1.0, topics.size() / 3.0);
        return Math.min(1.0, score);
    }
}
