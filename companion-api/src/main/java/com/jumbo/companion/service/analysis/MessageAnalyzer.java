package com.jumbo.companion.service.analysis;

import com.jumbo.companion.model.MessageAnalysis;

public interface MessageAnalyzer {

    /**
     * Classifies a raw user message. Never throws; unrecognised or empty input yields a neutral analysis.
     */
    MessageAnalysis analyze(String text);
}
