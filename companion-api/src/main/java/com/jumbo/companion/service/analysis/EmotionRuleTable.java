package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.Emotion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword rules per emotion category. A category's score is the sum of its distinct matched keyword
 * weights scaled by the strongest intensity modifier; confidence divides that by the category's
 * full-confidence weight.
 */
public final class EmotionRuleTable {

    public static final double HIGH = 3.0;
    public static final double MEDIUM = 2.0;
    public static final double LOW = 1.0;

    private static final int NEGATION_DISTANCE = 2;
    private static final Set<String> NEGATIONS = Set.of("not", "never", "no", "hardly");

    private final Map<Emotion, Category> categories;
    private final Map<String, Double> modifiers;

    private EmotionRuleTable(Map<Emotion, Category> categories, Map<String, Double> modifiers) {
        this.categories = Collections.unmodifiableMap(new EnumMap<>(categories));
        this.modifiers = Map.copyOf(modifiers);
    }

    public static EmotionRuleTable defaults() {
        Map<Emotion, Category> categories = new EnumMap<>(Emotion.class);
        categories.put(Emotion.SADNESS, new Category(3.0, List.of(
                new KeywordRule("depressed", HIGH),
                new KeywordRule("heartbroken", HIGH),
                new KeywordRule("miserable", HIGH),
                new KeywordRule("hopeless", HIGH),
                new KeywordRule("sad", MEDIUM),
                new KeywordRule("lonely", MEDIUM),
                new KeywordRule("unhappy", MEDIUM),
                new KeywordRule("upset", MEDIUM),
                new KeywordRule("crying", MEDIUM),
                new KeywordRule("grieving", MEDIUM),
                new KeywordRule("hurt", LOW),
                new KeywordRule("down", LOW),
                new KeywordRule("alone", LOW),
                new KeywordRule("empty", LOW),
                new KeywordRule("tired", LOW))));
        categories.put(Emotion.ANXIETY, new Category(3.0, List.of(
                new KeywordRule("anxious", HIGH),
                new KeywordRule("panic", HIGH),
                new KeywordRule("panicking", HIGH),
                new KeywordRule("worried", MEDIUM),
                new KeywordRule("nervous", MEDIUM),
                new KeywordRule("stressed", MEDIUM),
                new KeywordRule("scared", MEDIUM),
                new KeywordRule("afraid", MEDIUM),
                new KeywordRule("overwhelmed", MEDIUM),
                new KeywordRule("worry", LOW),
                new KeywordRule("tense", LOW),
                new KeywordRule("uneasy", LOW))));
        categories.put(Emotion.ANGER, new Category(3.0, List.of(
                new KeywordRule("furious", HIGH),
                new KeywordRule("pissed", HIGH),
                new KeywordRule("angry", MEDIUM),
                new KeywordRule("mad", MEDIUM),
                new KeywordRule("frustrated", MEDIUM),
                new KeywordRule("hate", MEDIUM),
                new KeywordRule("annoyed", LOW),
                new KeywordRule("irritated", LOW),
                new KeywordRule("unfair", LOW))));
        categories.put(Emotion.HAPPINESS, new Category(3.0, List.of(
                new KeywordRule("excited", HIGH),
                new KeywordRule("thrilled", HIGH),
                new KeywordRule("happy", MEDIUM),
                new KeywordRule("glad", MEDIUM),
                new KeywordRule("grateful", MEDIUM),
                new KeywordRule("wonderful", MEDIUM),
                new KeywordRule("amazing", MEDIUM),
                new KeywordRule("great", LOW),
                new KeywordRule("good", LOW),
                new KeywordRule("proud", LOW))));

        Map<String, Double> modifiers = Map.ofEntries(
                Map.entry("really", 1.2),
                Map.entry("very", 1.3),
                Map.entry("so", 1.2),
                Map.entry("super", 1.3),
                Map.entry("extremely", 1.5),
                Map.entry("incredibly", 1.5),
                Map.entry("totally", 1.3),
                Map.entry("a bit", 0.7),
                Map.entry("a little", 0.7),
                Map.entry("slightly", 0.6),
                Map.entry("kind of", 0.8),
                Map.entry("kinda", 0.8),
                Map.entry("somewhat", 0.8));
        return new EmotionRuleTable(categories, modifiers);
    }

    public Optional<Category> category(Emotion emotion) {
        return Optional.ofNullable(categories.get(emotion));
    }

    /**
     * Scores every category for the message; the winner is the highest score, earlier enum constants
     * winning ties. Returns {@link Emotion#NEUTRAL} with confidence 0 when nothing matched.
     */
    Score score(Tokens tokens) {
        double modifier = strongestModifier(tokens);
        Emotion best = Emotion.NEUTRAL;
        double bestScore = 0.0;
        for (Emotion emotion : Emotion.values()) {
            Category category = categories.get(emotion);
            if (category == null) {
                continue;
            }
            double raw = category.rawScore(tokens);
            if (raw <= 0.0) {
                continue;
            }
            double scaled = raw * modifier;
            if (scaled > bestScore) {
                bestScore = scaled;
                best = emotion;
            }
        }
        if (best == Emotion.NEUTRAL) {
            return new Score(Emotion.NEUTRAL, 0.0);
        }
        double confidence = bestScore / categories.get(best).fullConfidenceWeight();
        return new Score(best, Math.max(0.0, Math.min(1.0, confidence)));
    }

    private double strongestModifier(Tokens tokens) {
        double strongest = 1.0;
        for (Map.Entry<String, Double> entry : modifiers.entrySet()) {
            if (tokens.contains(entry.getKey()) && Math.abs(entry.getValue() - 1.0) > Math.abs(strongest - 1.0)) {
                strongest = entry.getValue();
            }
        }
        return strongest;
    }

    static boolean negated(Tokens tokens, int index) {
        List<String> words = tokens.words();
        for (int i = Math.max(0, index - NEGATION_DISTANCE); i < index; i++) {
            String word = words.get(i);
            if (NEGATIONS.contains(word) || word.endsWith("n't")) {
                return true;
            }
        }
        return false;
    }

    record Score(Emotion emotion, double confidence) {
    }

    public record KeywordRule(String keyword, double weight) {
    }

    public record Category(double fullConfidenceWeight, List<KeywordRule> rules) {

        public Category {
            rules = List.copyOf(rules);
        }

        double rawScore(Tokens tokens) {
            double total = 0.0;
            List<String> matched = new ArrayList<>();
            for (KeywordRule rule : rules) {
                if (matched.contains(rule.keyword())) {
                    continue;
                }
                boolean counted = tokens.indexesOf(rule.keyword()).stream()
                        .anyMatch(index -> !negated(tokens, index));
                if (counted) {
                    matched.add(rule.keyword());
                    total += rule.weight();
                }
            }
            return total;
        }
    }
}
