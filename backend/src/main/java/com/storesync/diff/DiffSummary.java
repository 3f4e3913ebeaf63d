package com.storesync.diff;

import com.storesync.domain.EntityType;

import java.util.List;

/**
 * Counts are always derived from the results; build through {@link #of(List)}.
 */
public record DiffSummary(int totalChanges, int creates, int updates, int deletes, List<DiffResult> results) {

    public static DiffSummary of(List<DiffResult> results) {
        int creates = 0;
        int updates = 0;
        int deletes = 0;
        for (DiffResult r : results) {
            switch (r.operation()) {
                case CREATE -> creates++;
                case UPDATE -> updates++;
                case DELETE -> deletes++;
            }
        }
        return new DiffSummary(results.size(), creates, updates, deletes, List.copyOf(results));
    }

    public boolean hasChanges() {
        return totalChanges > 0;
    }

    public List<DiffResult> resultsFor(EntityType type) {
        return results.stream().filter(r -> r.entityType() == type).toList();
    }

    public List<DiffResult> resultsFor(EntityType type, DiffOperation operation) {
        return results.stream().filter(r -> r.entityType() == type && r.operation() == operation).toList();
    }
}
