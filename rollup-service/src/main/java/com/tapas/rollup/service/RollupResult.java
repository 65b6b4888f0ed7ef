package com.tapas.rollup.service;

import com.tapas.rollup.domain.ParentRecord;

import java.util.List;

/**
 * Merged parent records from one recalculation, ready for the caller to persist.
 */
public record RollupResult(List<ParentRecord> parents, List<ContextKey> contexts) {

    private static final RollupResult EMPTY = new RollupResult(List.of(), List.of());

    public RollupResult {
        parents = List.copyOf(parents);
        contexts = List.copyOf(contexts);
    }

    public static RollupResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return parents.isEmpty();
    }
}
