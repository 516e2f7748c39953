package com.jumbo.companion.model;

public record Entity(
        String text,
        EntityType type,
        String relationship,
        double confidence
) {

    public static Entity person(String name, String relationship, double confidence) {
        return new Entity(name, EntityType.PERSON_NAME, relationship, confidence);
    }

    public static Entity relationshipTerm(String term) {
        return new Entity(term, EntityType.RELATIONSHIP_TERM, term, 1.0);
    }
}
