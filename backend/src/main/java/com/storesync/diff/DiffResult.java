package com.storesync.diff;

import com.storesync.domain.EntityType;

import java.util.List;

/**
 * Planned action for one entity. CREATE carries only {@code desired}, DELETE only {@code current},
 * UPDATE both and at least one change. {@code entityKey} is the natural key the entity was matched
 * on; {@code entityName} is its display name.
 */
public record DiffResult(
        DiffOperation operation,
        EntityType entityType,
        String entityKey,
        String entityName,
        Object current,
        Object desired,
        List<DiffChange> changes) {

    public DiffResult {
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public static DiffResult create(EntityType type, String key, String name, Object desired) {
        return new DiffResult(DiffOperation.CREATE, type, key, name, null, desired, List.of());
    }

    public static DiffResult update(EntityType type, String key, String name, Object current, Object desired,
                                    List<DiffChange> changes) {
        return new DiffResult(DiffOperation.UPDATE, type, key, name, current, desired, changes);
    }

    public static DiffResult delete(EntityType type, String key, String name, Object current) {
        return new DiffResult(DiffOperation.DELETE, type, key, name, current, null, List.of());
    }
}
