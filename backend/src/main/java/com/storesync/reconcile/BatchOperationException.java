package com.storesync.reconcile;

import com.storesync.common.StoreSyncException;

import java.util.List;

/**
 * Some items of a bootstrap batch failed. Carries the full report, including the items that succeeded.
 */
public class BatchOperationException extends StoreSyncException {

    private final transient BatchReport<?> report;

    public BatchOperationException(BatchReport<?> report) {
        super("Failed to reconcile " + report.failures().size() + " of " + report.total() + " "
                + report.entityType().getDisplayName().toLowerCase() + ": " + report.failureSummary());
        this.report = report;
    }

    public BatchReport<?> getReport() {
        return report;
    }

    public List<String> getFailedKeys() {
        return report.failures().stream().map(BatchReport.FailedItem::key).toList();
    }
}
