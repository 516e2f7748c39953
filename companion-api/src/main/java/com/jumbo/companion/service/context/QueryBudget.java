package com.jumbo.companion.service.context;

/**
 * Counts store reads for a single turn. Not thread-safe; one instance per turn.
 */
public class QueryBudget {

    public static final int HARD_LIMIT = 3;

    private final int maxReads;
    private int used;

    public QueryBudget(int maxReads) {
        this.maxReads = Math.max(0, Math.min(HARD_LIMIT, maxReads));
    }

    public boolean tryAcquire() {
        if (used >= maxReads) {
            return false;
        }
        used++;
        return true;
    }

    public int used() {
        return used;
    }

    public int remaining() {
        return maxReads - used;
    }
}
