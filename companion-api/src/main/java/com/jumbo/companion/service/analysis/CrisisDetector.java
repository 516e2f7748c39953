package com.jumbo.companion.service.analysis;

import java.util.List;

/**
 * Flags messages containing self-harm language so the turn can be answered with crisis-safe text.
 */
class CrisisDetector {

    private static final List<String> PHRASES = List.of(
            "suicide",
            "suicidal",
            "kill myself",
            "end my life",
            "not worth living",
            "hurt myself",
            "self harm",
            "better off dead",
            "end it all",
            "want to die");

    boolean isCrisis(Tokens tokens) {
        String joined = String.join(" ", tokens.words()).replace('-', ' ');
        String padded = " " + joined + " ";
        return PHRASES.stream().anyMatch(phrase -> padded.contains(" " + phrase + " "));
    }
}
