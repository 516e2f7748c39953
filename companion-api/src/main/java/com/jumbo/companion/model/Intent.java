package com.jumbo.companion.model;

import java.util.Locale;

public enum Intent {
    GREETING,
    EMOTIONAL_SUPPORT,
    MEMORY_RECALL,
    CASUAL_CHAT;

    /**
     * Template category that serves this intent.
     */
    public String category() {
        return name().toLowerCase(Locale.ROOT);
    }
}
