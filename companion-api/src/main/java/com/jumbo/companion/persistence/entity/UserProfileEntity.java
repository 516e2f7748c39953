package com.jumbo.companion.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "user_profiles")
public class UserProfileEntity {

    @Id
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "preferred_name", length = 128)
    private String preferredName;

    @Column(name = "preferences_json", columnDefinition = "text")
    private String preferencesJson;

    @Column(name = "relationships_json", columnDefinition = "text")
    private String relationshipsJson;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected UserProfileEntity() {
    }

    public UserProfileEntity(String userId, String preferredName, String preferencesJson, String relationshipsJson) {
        this.userId = userId;
        this.preferredName = preferredName;
        this.preferencesJson = preferencesJson;
        this.relationshipsJson = relationshipsJson;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = OffsetDateTime.now();
    }

    public String getUserId() {
        return userId;
    }

    public String getPreferredName() {
        return preferredName;
    }

    public void setPreferredName(String preferredName) {
        this.preferredName = preferredName;
    }

    public String getPreferencesJson() {
        return preferencesJson;
    }

    public void setPreferencesJson(String preferencesJson) {
        this.preferencesJson = preferencesJson;
    }

    public String getRelationshipsJson() {
        return relationshipsJson;
    }

    public void setRelationshipsJson(String relationshipsJson) {
        this.relationshipsJson = relationshipsJson;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
