package com.jumbo.companion.service.memory;

import com.jumbo.companion.model.MemoryRecord;
import com.jumbo.companion.persistence.entity.MemoryEntity;
import com.jumbo.companion.persistence.repository.MemoryRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@Profile("!inmemory")
@Transactional(readOnly = true)
public class JpaMemoryStore implements MemoryStore {

    private final MemoryRepository repository;

    public JpaMemoryStore(MemoryRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<MemoryRecord> getRecentMemories(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit)).stream()
                .map(JpaMemoryStore::toRecord)
                .toList();
    }

    @Override
    public List<MemoryRecord> searchMemories(String userId, Collection<String> keywords, int limit) {
        if (limit <= 0 || keywords == null || keywords.isEmpty()) {
            return List.of();
        }
        PageRequest page = PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        return repository.findAll(MemoryRepository.mentioningAny(userId, keywords), page).stream()
                .map(JpaMemoryStore::toRecord)
                .toList();
    }

    static MemoryRecord toRecord(MemoryEntity entity) {
        return new MemoryRecord(
                entity.getId(),
                entity.getKind(),
                entity.getContent(),
                entity.getSubjectName(),
                entity.getRelationship(),
                entity.getEmotion(),
                entity.getCreatedAt()
        );
    }
}
