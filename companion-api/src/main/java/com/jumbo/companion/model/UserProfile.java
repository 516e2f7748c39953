package com.jumbo.companion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored profile of a user. Relationship order is kept as stored; the first entry is the default friend.
 */
public record UserProfile(
        String userId,
        String preferredName,
        Map<String, Object> preferences,
        Map<String, String> keyRelationships
) {

    public UserProfile {
        preferences = preferences == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
        keyRelationships = keyRelationships == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keyRelationships));
    }
}
