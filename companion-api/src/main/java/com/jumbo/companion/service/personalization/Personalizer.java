package com.jumbo.companion.service.personalization;

import com.jumbo.companion.model.MemoryRecord;
import com.jumbo.companion.model.ResponseTemplate;
import com.jumbo.companion.model.UserContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code [NAME]}, {@code [MEMORY]} and {@code [FRIEND_NAME]} from the user context. A clause whose
 * placeholder cannot be filled is dropped, and a sentence left without clauses is dropped with it.
 */
@Component
public class Personalizer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\[(NAME|MEMORY|FRIEND_NAME)]");
    private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]*");
    private static final int MAX_MEMORY_LENGTH = 120;

    private enum Placeholder {
        NAME, MEMORY, FRIEND_NAME
    }

    public PersonalizedText personalize(String templateText, UserContext context, List<String> mentionedNames) {
        Set<Placeholder> resolved = EnumSet.noneOf(Placeholder.class);
        String text = fill(templateText, context, mentionedNames, resolved);
        int memoriesUsed = (resolved.contains(Placeholder.MEMORY) ? 1 : 0)
                + (resolved.contains(Placeholder.FRIEND_NAME) ? 1 : 0);
        return new PersonalizedText(text, memoriesUsed, false);
    }

    /**
     * Personalizes the chosen variation and appends the template's next follow-up question unless the text
     * already ends with a question.
     */
    public PersonalizedText personalize(ResponseTemplate template,
                                        String variation,
                                        UserContext context,
                                        List<String> mentionedNames,
                                        int followUpCursor) {
        PersonalizedText body = personalize(variation, context, mentionedNames);
        List<String> questions = template.followUpQuestions();
        if (questions.isEmpty() || body.text().endsWith("?")) {
            return body;
        }
        String question = fill(questions.get(Math.floorMod(followUpCursor, questions.size())), context, mentionedNames,
                EnumSet.noneOf(Placeholder.class));
        if (question.isEmpty()) {
            return body;
        }
        String text = body.text().isEmpty() ? question : body.text() + " " + question;
        return new PersonalizedText(text, body.memoriesUsed(), true);
    }

    private String fill(String text, UserContext context, List<String> mentionedNames, Set<Placeholder> resolved) {
        if (text == null || text.isBlank()) {
            return "";
        }
        List<String> sentences = new ArrayList<>();
        Matcher sentenceMatcher = SENTENCE.matcher(text);
        while (sentenceMatcher.find()) {
            String sentence = sentenceMatcher.group().trim();
            if (sentence.isEmpty()) {
                continue;
            }
            String kept = fillSentence(sentence, context, mentionedNames, resolved);
            if (!kept.isEmpty()) {
                sentences.add(kept);
            }
        }
        return String.join(" ", sentences);
    }

    private String fillSentence(String sentence, UserContext context, List<String> mentionedNames,
                                Set<Placeholder> resolved) {
        String terminal = terminalPunctuation(sentence);
        String body = sentence.substring(0, sentence.length() - terminal.length());
        List<String> clauses = new ArrayList<>();
        for (String clause : body.split(",")) {
            Optional<String> filled = fillClause(clause, context, mentionedNames, resolved);
            filled.map(String::trim).filter(value -> !value.isEmpty()).ifPresent(clauses::add);
        }
        if (clauses.isEmpty()) {
            return "";
        }
        String joined = String.join(", ", clauses).replaceAll("\\s{2,}", " ").replaceAll("\\s+([,.!?])", "$1");
        return capitalize(joined) + (terminal.isEmpty() ? "." : terminal);
    }

    private Optional<String> fillClause(String clause, UserContext context, List<String> mentionedNames,
                                        Set<Placeholder> resolved) {
        Matcher matcher = PLACEHOLDER.matcher(clause);
        StringBuilder out = new StringBuilder();
        Set<Placeholder> used = EnumSet.noneOf(Placeholder.class);
        while (matcher.find()) {
            Placeholder placeholder = Placeholder.valueOf(matcher.group(1));
            Optional<String> value = resolve(placeholder, context, mentionedNames);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            used.add(placeholder);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value.get()));
        }
        matcher.appendTail(out);
        resolved.addAll(used);
        return Optional.of(out.toString());
    }

    private Optional<String> resolve(Placeholder placeholder, UserContext context, List<String> mentionedNames) {
        return switch (placeholder) {
            case NAME -> context.name();
            case MEMORY -> context.relevantMemories().stream()
                    .map(MemoryRecord::content)
                    .filter(content -> content != null && !content.isBlank())
                    .map(Personalizer::memoryPhrase)
                    .findFirst();
            case FRIEND_NAME -> friendName(context, mentionedNames);
        };
    }

    private static Optional<String> friendName(UserContext context, List<String> mentionedNames) {
        for (String name : mentionedNames) {
            for (Map.Entry<String, String> entry : context.keyRelationships().entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return context.keyRelationships().keySet().stream().findFirst();
    }

    private static String memoryPhrase(String content) {
        String trimmed = content.replaceAll("\\s+", " ").trim();
        if (trimmed.length() > MAX_MEMORY_LENGTH) {
            int cut = trimmed.lastIndexOf(' ', MAX_MEMORY_LENGTH);
            trimmed = trimmed.substring(0, cut > 0 ? cut : MAX_MEMORY_LENGTH);
        }
        return trimmed.replaceAll("[.!?,;:]+$", "");
    }

    private static String terminalPunctuation(String sentence) {
        int end = sentence.length();
        while (end > 0 && ".!?".indexOf(sentence.charAt(end - 1)) >= 0) {
            end--;
        }
        return sentence.substring(end);
    }

    private static String capitalize(String text) {
        if (text.isEmpty() || !Character.isLowerCase(text.charAt(0))) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
