package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.Emotion;
import com.jumbo.companion.model.Intent;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered intent rules; the first rule that matches wins and {@link Intent#CASUAL_CHAT} is the default.
 */
public class IntentClassifier {

    private static final Pattern SUPPORT = Pattern.compile(
            "(?i)\\b(feel|feeling|felt|struggling|can't cope|cannot cope|need to talk|need help|vent|going through)\\b");
    private static final Pattern RECALL = Pattern.compile(
            "(?i)\\b(remember|recall|last time|you said|i told you|we talked about)\\b");
    private static final Pattern ASKING_AFTER_SOMEONE = Pattern.compile(
            "\\b[Hh]ow(?:'s| is| was| are| has)\\s+(?:(?i:my)\\s+\\w+\\s+)?[A-Z][a-z]+");
    private static final Pattern GREETING = Pattern.compile(
            "(?i)^\\s*(hi|hello|hey|hiya|namaste|good (morning|afternoon|evening))\\b");

    private final List<Rule> rules = List.of(
            new Rule(Intent.EMOTIONAL_SUPPORT, (text, emotion) ->
                    SUPPORT.matcher(text).find() || (emotion != Emotion.NEUTRAL && emotion != Emotion.HAPPINESS)),
            new Rule(Intent.MEMORY_RECALL, (text, emotion) ->
                    RECALL.matcher(text).find() || ASKING_AFTER_SOMEONE.matcher(text).find()),
            new Rule(Intent.GREETING, (text, emotion) -> GREETING.matcher(text).find())
    );

    public Intent classify(String text, Emotion emotion) {
        if (text == null || text.isBlank()) {
            return Intent.CASUAL_CHAT;
        }
        return rules.stream()
                .filter(rule -> rule.condition().matches(text, emotion))
                .map(Rule::intent)
                .findFirst()
                .orElse(Intent.CASUAL_CHAT);
    }

    @FunctionalInterface
    interface Condition {
        boolean matches(String text, Emotion emotion);
    }

    record Rule(Intent intent, Condition condition) {
    }
}
