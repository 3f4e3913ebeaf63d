package com.storesync.deploy;

import com.storesync.resilience.StageMetrics;

import java.time.Instant;
import java.util.List;

/**
 * What a deploy run planned and what each stage did.
 *
 * @param deletes planned deletions; reported only, never applied
 */
public record DeploymentReport(
        Instant startedAt,
        Instant finishedAt,
        long durationMs,
        int creates,
        int updates,
        int deletes,
        List<StageReport> stages,
        StageMetrics totals,
        boolean cancelled) {

    public DeploymentReport {
        stages = List.copyOf(stages);
    }

    public boolean hasFailures() {
        return stages.stream().anyMatch(StageReport::hasFailures);
    }

    public int failedEntities() {
        return stages.stream().mapToInt(s -> s.failures().size()).sum();
    }
}
