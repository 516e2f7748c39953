package com.jumbo.companion.persistence.entity;

import com.jumbo.companion.model.MemoryKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "memories", indexes = @Index(name = "idx_memories_user_created", columnList = "user_id, created_at"))
public class MemoryEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private MemoryKind kind;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    @Column(name = "subject_name", length = 128)
    private String subjectName;

    @Column(name = "relationship", length = 64)
    private String relationship;

    @Column(name = "emotion", length = 32)
    private String emotion;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected MemoryEntity() {
    }

    public MemoryEntity(String userId,
                        MemoryKind kind,
                        String content,
                        String subjectName,
                        String relationship,
                        String emotion,
                        OffsetDateTime createdAt) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.kind = kind;
        this.content = content;
        this.subjectName = subjectName;
        this.relationship = relationship;
        this.emotion = emotion;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public MemoryKind getKind() {
        return kind;
    }

    public String getContent() {
        return content;
    }

    public String getSubjectName() {
        return subjectName;
    }

    public String getRelationship() {
        return relationship;
    }

    public String getEmotion() {
        return emotion;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
