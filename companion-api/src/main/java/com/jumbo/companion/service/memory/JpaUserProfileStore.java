package com.jumbo.companion.service.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.companion.model.UserProfile;
import com.jumbo.companion.persistence.entity.UserProfileEntity;
import com.jumbo.companion.persistence.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

@Service
@Profile("!inmemory")
@Transactional(readOnly = true)
public class JpaUserProfileStore implements UserProfileStore {

    private static final Logger log = LoggerFactory.getLogger(JpaUserProfileStore.class);

    private final UserProfileRepository repository;
    private final ObjectMapper objectMapper;

    public JpaUserProfileStore(UserProfileRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<UserProfile> getPreferences(String userId) {
        return repository.findById(userId).map(this::toProfile);
    }

    private UserProfile toProfile(UserProfileEntity entity) {
        return new UserProfile(
                entity.getUserId(),
                entity.getPreferredName(),
                fromJson(entity.getPreferencesJson(), new TypeReference<Map<String, Object>>() {
                }, entity.getUserId()),
                fromJson(entity.getRelationshipsJson(), new TypeReference<Map<String, String>>() {
                }, entity.getUserId())
        );
    }

    private <T> Map<String, T> fromJson(String json, TypeReference<Map<String, T>> type, String userId) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable profile JSON for user {}: {}", userId, e.getOriginalMessage());
            return Map.of();
        }
    }
}
