package com.storesync.reconcile;

import com.storesync.domain.EntityType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-item outcome of {@link ReconciliationService#bootstrap}. Successes and failures keep input order.
 */
public record BatchReport<T>(
        EntityType entityType,
        List<Reconciled<T>> successes,
        List<FailedItem> failures,
        boolean cancelled) {

    public BatchReport {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public static <T> BatchReport<T> empty(EntityType type) {
        return new BatchReport<>(type, List.of(), List.of(), false);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int total() {
        return successes.size() + failures.size();
    }

    public long count(ReconcileAction action) {
        return successes.stream().filter(s -> s.action() == action).count();
    }

    /** "key: message; key: message" */
    public String failureSummary() {
        return failures.stream().map(f -> f.key() + ": " + f.message()).collect(Collectors.joining("; "));
    }

    public record FailedItem(String key, String message, RuntimeException error) {
    }
}
