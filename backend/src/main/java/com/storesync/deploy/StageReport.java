package com.storesync.deploy;

import com.storesync.domain.EntityType;
import com.storesync.resilience.StageMetrics;

import java.util.List;

/**
 * Outcome of one deployment stage.
 *
 * @param error stage-level failure that stopped the stage before per-item results existed; null otherwise
 */
public record StageReport(
        String stageName,
        EntityType entityType,
        long durationMs,
        int created,
        int updated,
        int unchanged,
        List<FailedEntity> failures,
        String error,
        StageMetrics metrics) {

    public StageReport {
        failures = failures != null ? List.copyOf(failures) : List.of();
        metrics = metrics != null ? metrics : StageMetrics.EMPTY;
    }

    public boolean hasFailures() {
        return !failures.isEmpty() || error != null;
    }

    public record FailedEntity(String key, String message) {
    }
}
