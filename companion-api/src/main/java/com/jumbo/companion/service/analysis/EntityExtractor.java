package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.Entity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds people and relationship terms in a message. Names introduced by a relationship cue carry that
 * relationship; other capitalised mid-sentence words are reported with lower confidence.
 */
public class EntityExtractor {

    static final double CUE_CONFIDENCE = 0.9;
    static final double CAPITALISED_CONFIDENCE = 0.6;

    private static final Map<String, String> RELATIONSHIP_TERMS = Map.ofEntries(
            Map.entry("best friend", "friend"),
            Map.entry("friend", "friend"),
            Map.entry("brother", "brother"),
            Map.entry("sister", "sister"),
            Map.entry("mom", "mother"),
            Map.entry("mum", "mother"),
            Map.entry("mother", "mother"),
            Map.entry("dad", "father"),
            Map.entry("father", "father"),
            Map.entry("wife", "wife"),
            Map.entry("husband", "husband"),
            Map.entry("partner", "partner"),
            Map.entry("boyfriend", "boyfriend"),
            Map.entry("girlfriend", "girlfriend"),
            Map.entry("son", "son"),
            Map.entry("daughter", "daughter"),
            Map.entry("cousin", "cousin"),
            Map.entry("boss", "boss"),
            Map.entry("colleague", "colleague"),
            Map.entry("roommate", "roommate"),
            Map.entry("grandma", "grandmother"),
            Map.entry("grandpa", "grandfather"),
            Map.entry("aunt", "aunt"),
            Map.entry("uncle", "uncle"));

    private static final Pattern CUE = Pattern.compile(
            "(?i:\\bmy\\s+(best friend|friend|brother|sister|mom|mum|mother|dad|father|wife|husband|partner"
                    + "|boyfriend|girlfriend|son|daughter|cousin|boss|colleague|roommate|grandma|grandpa|aunt|uncle))"
                    + "\\s*,?\\s+([A-Z][a-z'-]+)");
    private static final Pattern RAW_WORD = Pattern.compile("[\\p{L}][\\p{L}'-]*|[.!?]");
    private static final Pattern CAPITALISED = Pattern.compile("[A-Z][a-z]+");

    private static final Set<String> COMMON_WORDS = Set.of(
            "i", "i'm", "i've", "i'll", "i'd", "im", "ok", "okay", "hi", "hello", "hey", "yes", "no", "god",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june", "july", "august", "september", "october",
            "november", "december", "christmas", "english", "internet", "mr", "mrs", "ms", "dr", "jumbo");

    public List<Entity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Entity> entities = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();

        Matcher cue = CUE.matcher(text);
        while (cue.find()) {
            String name = cue.group(2);
            if (isCommon(name) || !names.add(name)) {
                continue;
            }
            String relationship = RELATIONSHIP_TERMS.get(cue.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
            entities.add(Entity.person(name, relationship, CUE_CONFIDENCE));
        }

        List<String> raw = new ArrayList<>();
        Matcher word = RAW_WORD.matcher(text.replace('’', '\''));
        while (word.find()) {
            raw.add(word.group());
        }
        for (int i = 1; i < raw.size(); i++) {
            String candidate = stripPossessive(raw.get(i));
            String previous = raw.get(i - 1);
            boolean sentenceStart = previous.matches("[.!?]");
            if (sentenceStart || !CAPITALISED.matcher(candidate).matches() || isCommon(candidate)) {
                continue;
            }
            if (names.add(candidate)) {
                entities.add(Entity.person(candidate, null, CAPITALISED_CONFIDENCE));
            }
        }

        Tokens tokens = Tokens.of(text);
        Set<String> terms = new LinkedHashSet<>();
        for (String term : RELATIONSHIP_TERMS.keySet()) {
            if (tokens.contains(term)) {
                terms.add(RELATIONSHIP_TERMS.get(term));
            }
        }
        terms.stream().sorted().forEach(term -> entities.add(Entity.relationshipTerm(term)));
        return List.copyOf(entities);
    }

    private static String stripPossessive(String word) {
        if (word.endsWith("'s")) {
            return word.substring(0, word.length() - 2);
        }
        return word.endsWith("'") ? word.substring(0, word.length() - 1) : word;
    }

    private static boolean isCommon(String word) {
        return COMMON_WORDS.contains(word.toLowerCase(Locale.ROOT));
    }
}
