package com.storesync.reconcile;

import com.storesync.batch.ChunkOptions;
import com.storesync.batch.ChunkedProcessorResult;
import com.storesync.batch.ItemFailure;
import com.storesync.batch.ItemSuccess;
import com.storesync.common.CancellationToken;
import com.storesync.common.ValidationException;
import com.storesync.diff.EntityComparator;
import com.storesync.domain.EntityType;
import com.storesync.domain.RemoteEntity;
import com.storesync.domain.StoreConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Brings remote entities of one family in line with the desired inputs, one at a time
 * ({@link #getOrCreate}) or as a batch ({@link #bootstrap}). Every remote call goes through the
 * run's {@link com.storesync.resilience.ResilienceContext}.
 */
@Slf4j
public abstract class ReconciliationService<T> {

    private final EntityRepository<T> repository;
    private final EntityComparator<T> comparator;
    private final ReconciliationSupport support;

    protected ReconciliationService(EntityRepository<T> repository, EntityComparator<T> comparator,
                                    ReconciliationSupport support) {
        this.repository = repository;
        this.comparator = comparator;
        this.support = support;
    }

    public EntityType entityType() {
        return comparator.entityType();
    }

    public String keyOf(T entity) {
        return comparator.keyOf(entity);
    }

    /** This family's section of a store configuration. */
    public abstract List<T> sectionOf(StoreConfig config);

    /**
     * Rejects inputs missing required fields.
     *
     * @throws ValidationException naming the offending field
     */
    protected abstract void validate(T input);

    public List<T> fetchCurrent(CancellationToken token) {
        List<T> current = support.resilience().execute("fetch " + label(), repository::fetchAll, token);
        log.debug("Fetched {} remote {}", current.size(), label());
        return current;
    }

    /**
     * Finds the entity by natural key and creates it when absent, updates it when its declared
     * fields differ, or leaves it alone.
     */
    public Reconciled<T> getOrCreate(T input, CancellationToken token) {
        validate(input);
        String key = keyOf(input);
        Optional<RemoteEntity<T>> existing = support.resilience()
                .execute("find " + label() + " '" + key + "'", () -> repository.findByKey(key), token);
        if (existing.isEmpty()) {
            RemoteEntity<T> created = support.resilience()
                    .execute("create " + label() + " '" + key + "'", () -> repository.create(input), token);
            log.info("Created {} '{}'", singular(), key);
            return new Reconciled<>(key, ReconcileAction.CREATED, created);
        }
        RemoteEntity<T> remote = existing.get();
        if (comparator.compare(List.of(input), List.of(remote.entity())).isEmpty()) {
            log.debug("{} '{}' already up to date", singular(), key);
            return new Reconciled<>(key, ReconcileAction.UNCHANGED, remote);
        }
        RemoteEntity<T> updated = support.resilience()
                .execute("update " + label() + " '" + key + "'", () -> repository.update(remote.id(), input), token);
        log.info("Updated {} '{}'", singular(), key);
        return new Reconciled<>(key, ReconcileAction.UPDATED, updated);
    }

    /**
     * Reconciles every input. Inputs are validated up front, so a validation problem fails the whole
     * batch before any remote call. Small batches run all at once; larger ones run chunk by chunk.
     *
     * @throws BatchOperationException when an item failed and partial failure is not tolerated
     */
    public BatchReport<T> bootstrap(List<T> inputs, CancellationToken token) {
        if (inputs == null || inputs.isEmpty()) {
            return BatchReport.empty(entityType());
        }
        validateAll(inputs);
        BatchSettings settings = support.settings();
        List<ItemResult<T>> results = new ArrayList<>();
        boolean cancelled = false;
        for (List<T> level : dependencyLevels(inputs)) {
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            if (level.size() <= settings.bulkThreshold()) {
                log.info("Reconciling {} {}", level.size(), label());
                results.addAll(reconcileConcurrently(level, token));
                continue;
            }
            ChunkOptions options = new ChunkOptions(settings.chunkSize(), settings.chunkDelayMs(), label());
            ChunkedProcessorResult<T, ItemResult<T>> chunked = support.batchProcessor()
                    .processInChunksPerItem(level, chunk -> reconcileConcurrently(chunk, token), options, token);
            for (ItemSuccess<T, ItemResult<T>> s : chunked.successes()) {
                results.add(s.result());
            }
            for (ItemFailure<T> f : chunked.failures()) {
                results.add(new ItemResult<>(f.item(), null, f.error()));
            }
            if (chunked.cancelled()) {
                cancelled = true;
                break;
            }
        }
        BatchReport<T> report = toReport(inputs, results, cancelled);
        log.info("{}: {} created, {} updated, {} unchanged, {} failed", entityType().getDisplayName(),
                report.count(ReconcileAction.CREATED), report.count(ReconcileAction.UPDATED),
                report.count(ReconcileAction.UNCHANGED), report.failures().size());
        if (report.hasFailures() && settings.failOnPartialFailure()) {
            throw new BatchOperationException(report);
        }
        return report;
    }

    /**
     * Bootstraps the entities of the desired configuration whose keys are listed, in configuration order.
     */
    public BatchReport<T> bootstrapSelected(StoreConfig desired, Collection<String> keys, CancellationToken token) {
        Set<String> wanted = new HashSet<>(keys);
        List<T> selected = sectionOf(desired).stream()
                .filter(e -> wanted.contains(keyOf(e)))
                .toList();
        return bootstrap(selected, token);
    }

    /**
     * Groups inputs into levels reconciled one after another; items within a level may run
     * concurrently. Families whose entities reference each other override this.
     */
    protected List<List<T>> dependencyLevels(List<T> inputs) {
        return List.of(inputs);
    }

    private List<ItemResult<T>> reconcileConcurrently(List<T> items, CancellationToken token) {
        List<CompletableFuture<ItemResult<T>>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> reconcileOne(item, token), support.executor()));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private ItemResult<T> reconcileOne(T item, CancellationToken token) {
        try {
            return new ItemResult<>(item, getOrCreate(item, token), null);
        } catch (RuntimeException e) {
            log.warn("Failed to reconcile {} '{}': {}", singular(), keyOf(item), e.getMessage());
            return new ItemResult<>(item, null, e);
        }
    }

    private void validateAll(List<T> inputs) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (T input : inputs) {
            if (input == null) {
                throw new ValidationException(entityType().getDisplayName() + ": null entry in batch");
            }
            validate(input);
            String key = keyOf(input);
            if (!seen.add(key)) {
                duplicates.add(key);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ValidationException("Duplicate " + singular() + " identifiers: " + String.join(", ", duplicates), "key");
        }
    }

    private BatchReport<T> toReport(List<T> inputs, List<ItemResult<T>> results, boolean cancelled) {
        List<Reconciled<T>> successes = new ArrayList<>();
        List<BatchReport.FailedItem> failures = new ArrayList<>();
        for (T input : inputs) {
            for (ItemResult<T> r : results) {
                if (r.item() == input) {
                    if (r.error() == null) {
                        successes.add(r.success());
                    } else {
                        failures.add(new BatchReport.FailedItem(keyOf(input), messageOf(r.error()), r.error()));
                    }
                    break;
                }
            }
        }
        return new BatchReport<>(entityType(), successes, failures, cancelled);
    }

    protected void require(Object value, String field) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new ValidationException(entityType().getDisplayName() + ": " + field + " is required", field);
        }
    }

    private String label() {
        return entityType().getDisplayName().toLowerCase();
    }

    private String singular() {
        String l = label();
        if (l.endsWith("ies")) {
            return l.substring(0, l.length() - 3) + "y";
        }
        return l.endsWith("s") ? l.substring(0, l.length() - 1) : l;
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record ItemResult<T>(T item, Reconciled<T> success, RuntimeException error) {
    }
}
