package com.jumbo.companion.service.memory;

import com.jumbo.companion.model.MemoryRecord;

import java.util.Collection;
import java.util.List;

/**
 * Read side of the conversation and memory store. Every call counts as one store read.
 */
public interface MemoryStore {

    /**
     * Most recent memories first.
     */
    List<MemoryRecord> getRecentMemories(String userId, int limit);

    List<MemoryRecord> searchMemories(String userId, Collection<String> keywords, int limit);
}
