package com.jumbo.companion.service.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lower-cased word tokens of a message, with apostrophes kept so that contractions survive.
 */
final class Tokens {

    private static final Pattern WORD = Pattern.compile("[\\p{L}][\\p{L}']*");

    private final List<String> words;

    private Tokens(List<String> words) {
        this.words = words;
    }

    static Tokens of(String text) {
        List<String> words = new ArrayList<>();
        if (text != null) {
            Matcher matcher = WORD.matcher(text.replace('’', '\'').toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String word = matcher.group();
                while (word.endsWith("'")) {
                    word = word.substring(0, word.length() - 1);
                }
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        }
        return new Tokens(List.copyOf(words));
    }

    List<String> words() {
        return words;
    }

    int size() {
        return words.size();
    }

    boolean isEmpty() {
        return words.isEmpty();
    }

    /**
     * Start indexes where the phrase occurs as a whole-word sequence.
     */
    List<Integer> indexesOf(String phrase) {
        String[] parts = phrase.split(" ");
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i + parts.length <= words.size(); i++) {
            boolean match = true;
            for (int j = 0; j < parts.length; j++) {
                if (!words.get(i + j).equals(parts[j])) {
                    match = false;
                    break;
                }
            }
            if (match) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    boolean contains(String phrase) {
        return !indexesOf(phrase).isEmpty();
    }
}
