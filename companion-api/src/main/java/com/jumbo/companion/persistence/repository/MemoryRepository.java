package com.jumbo.companion.persistence.repository;

import com.jumbo.companion.persistence.entity.MemoryEntity;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

public interface MemoryRepository extends JpaRepository<MemoryEntity, String>, JpaSpecificationExecutor<MemoryEntity> {

    List<MemoryEntity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    /**
     * Memories of the user whose content contains any keyword or whose subject equals one, case-insensitively.
     */
    static Specification<MemoryEntity> mentioningAny(String userId, Collection<String> keywords) {
        return (root, query, builder) -> {
            Predicate[] matches = keywords.stream()
                    .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                    .map(keyword -> builder.or(
                            builder.like(builder.lower(root.get("content")), "%" + keyword + "%"),
                            builder.equal(builder.lower(root.get("subjectName")), keyword)))
                    .toArray(Predicate[]::new);
            return builder.and(builder.equal(root.get("userId"), userId), builder.or(matches));
        };
    }
}
