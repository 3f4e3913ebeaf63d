package com.storesync.deploy;

import com.storesync.common.CancellationToken;
import com.storesync.diff.DiffEngine;
import com.storesync.diff.DiffOperation;
import com.storesync.diff.DiffResult;
import com.storesync.diff.DiffSummary;
import com.storesync.domain.EntityType;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.BatchOperationException;
import com.storesync.reconcile.BatchReport;
import com.storesync.reconcile.ReconcileAction;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.RemoteStateReader;
import com.storesync.resilience.ResilienceContext;
import com.storesync.resilience.ResilienceTracker;
import com.storesync.resilience.StageMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Deploys a desired configuration: reads the remote state, diffs, then runs one stage per entity
 * family in deployment order, creating and updating only what the diff asks for. A failed stage is
 * recorded and later stages still run. Deletions are logged, not applied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeploymentPipeline {

    static final String MDC_STAGE = "stage";

    private final RemoteStateReader stateReader;
    private final DiffEngine diffEngine;
    private final ResilienceContext resilience;
    private final Clock clock;

    public DeploymentReport deploy(StoreConfig desired, CancellationToken token) {
        return deploy(desired, EnumSet.allOf(EntityType.class), token);
    }

    public DeploymentReport deploy(StoreConfig desired, Set<EntityType> include, CancellationToken token) {
        Instant startedAt = clock.instant();
        StoreConfig current = stateReader.read(include, token);
        DiffSummary plan = diffEngine.diff(desired, current, include);
        for (DiffResult r : plan.results()) {
            if (r.operation() == DiffOperation.DELETE) {
                log.warn("{} '{}' exists remotely but not in configuration; not deleting",
                        r.entityType().getDisplayName(), r.entityKey());
            }
        }

        List<StageReport> stages = new ArrayList<>();
        boolean cancelled = false;
        for (Map.Entry<EntityType, ReconciliationService<?>> entry : stateReader.services().entrySet()) {
            EntityType type = entry.getKey();
            if (!include.contains(type)) {
                continue;
            }
            List<String> keys = plan.resultsFor(type).stream()
                    .filter(r -> r.operation() != DiffOperation.DELETE)
                    .map(DiffResult::entityKey)
                    .toList();
            if (keys.isEmpty()) {
                continue;
            }
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            StageReport stage = runStage(type, entry.getValue(), desired, keys, token);
            stages.add(stage);
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
        }

        Instant finishedAt = clock.instant();
        StageMetrics totals = stages.stream().map(StageReport::metrics).reduce(StageMetrics.EMPTY, StageMetrics::plus);
        DeploymentReport report = new DeploymentReport(startedAt, finishedAt,
                Duration.between(startedAt, finishedAt).toMillis(),
                plan.creates(), plan.updates(), plan.deletes(), stages, totals, cancelled);
        log.info("Deployment finished in {} ms: {} stage(s), {} failed entit(ies){}", report.durationMs(),
                stages.size(), report.failedEntities(), cancelled ? " (cancelled)" : "");
        return report;
    }

    private StageReport runStage(EntityType type, ReconciliationService<?> service, StoreConfig desired,
                                 List<String> keys, CancellationToken token) {
        String stageName = type.getStageName();
        ResilienceTracker tracker = resilience.getTracker();
        long start = clock.millis();
        BatchReport<?> batch = null;
        String error = null;
        StageMetrics metrics = StageMetrics.EMPTY;
        tracker.startStageContext(stageName);
        MDC.put(MDC_STAGE, stageName);
        try {
            log.info("{} ({} to apply)", stageName, keys.size());
            batch = service.bootstrapSelected(desired, keys, token);
        } catch (BatchOperationException e) {
            batch = e.getReport();
            log.warn("{} finished with failures: {}", stageName, e.getMessage());
        } catch (CancellationException e) {
            error = "Cancelled";
            log.warn("{} cancelled", stageName);
        } catch (RuntimeException e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("{} failed: {}", stageName, error, e);
        } finally {
            MDC.remove(MDC_STAGE);
            metrics = tracker.endStageContext().orElse(StageMetrics.EMPTY);
        }
        long durationMs = clock.millis() - start;

        if (batch == null) {
            return new StageReport(stageName, type, durationMs, 0, 0, 0, List.of(), error, metrics);
        }
        List<StageReport.FailedEntity> failures = batch.failures().stream()
                .map(f -> new StageReport.FailedEntity(f.key(), f.message()))
                .toList();
        return new StageReport(stageName, type, durationMs,
                (int) batch.count(ReconcileAction.CREATED),
                (int) batch.count(ReconcileAction.UPDATED),
                (int) batch.count(ReconcileAction.UNCHANGED),
                failures, batch.cancelled() ? "Cancelled" : null, metrics);
    }
}
