package com.jumbo.companion.model;

public enum MemoryKind {
    CONVERSATION,
    FACT,
    PERSON
}
