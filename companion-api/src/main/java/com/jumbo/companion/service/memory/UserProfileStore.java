package com.jumbo.companion.service.memory;

import com.jumbo.companion.model.UserProfile;

import java.util.Optional;

public interface UserProfileStore {

    Optional<UserProfile> getPreferences(String userId);
}
