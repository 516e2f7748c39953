package com.jumbo.companion.model;

public enum EntityType {
    PERSON_NAME,
    RELATIONSHIP_TERM
}
