package com.jumbo.companion.model;

import java.time.OffsetDateTime;

public record MemoryRecord(
        String id,
        MemoryKind kind,
        String content,
        String subjectName,
        String relationship,
        String emotion,
        OffsetDateTime createdAt
) {

    public boolean describesPerson() {
        return kind == MemoryKind.PERSON && subjectName != null && !subjectName.isBlank();
    }
}
