package com.storesync.diff;

import com.storesync.domain.EntityType;

import java.util.List;

/**
 * Diffs the desired and current collections of one entity family.
 */
public interface EntityComparator<T> {

    EntityType entityType();

    String keyOf(T entity);

    List<DiffResult> compare(List<T> desired, List<T> current);
}
