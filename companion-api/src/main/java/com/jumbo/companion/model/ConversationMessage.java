package com.jumbo.companion.model;

import java.time.OffsetDateTime;

public record ConversationMessage(
        String text,
        Emotion emotion,
        OffsetDateTime timestamp
) {
}
