package com.storesync.diff;

import com.storesync.domain.EntityType;

import java.util.List;

/**
 * Plain-text rendering of a {@link DiffSummary} for the console.
 */
public final class DiffSummaryFormatter {

    private DiffSummaryFormatter() {
    }

    public static String format(DiffSummary summary) {
        if (!summary.hasChanges()) {
            return "No differences found; remote configuration is up to date.\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Configuration diff\n");
        for (EntityType type : EntityType.values()) {
            List<DiffResult> results = summary.resultsFor(type);
            if (results.isEmpty()) {
                continue;
            }
            sb.append('\n').append(type.getDisplayName()).append('\n');
            for (DiffResult r : results) {
                sb.append("  ").append(symbol(r.operation())).append(' ').append(r.entityName()).append('\n');
                for (DiffChange c : r.changes()) {
                    sb.append("      ").append(c.description()).append('\n');
                }
            }
        }
        sb.append('\n')
                .append("Total: ").append(summary.totalChanges()).append(" change(s) (")
                .append(summary.creates()).append(" to create, ")
                .append(summary.updates()).append(" to update, ")
                .append(summary.deletes()).append(" to delete)\n");
        return sb.toString();
    }

    private static String symbol(DiffOperation op) {
        return switch (op) {
            case CREATE -> "+";
            case UPDATE -> "~";
            case DELETE -> "-";
        };
    }
}
