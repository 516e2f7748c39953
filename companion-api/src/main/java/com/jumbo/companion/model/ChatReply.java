package com.jumbo.companion.model;

public record ChatReply(
        String responseText,
        ResponseMetadata metadata
) {
}
