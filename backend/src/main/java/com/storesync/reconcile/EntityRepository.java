package com.storesync.reconcile;

import com.storesync.domain.EntityType;
import com.storesync.domain.RemoteEntity;

import java.util.List;
import java.util.Optional;

/**
 * Remote persistence of one entity family. Implementations perform raw calls; retries and pacing
 * are applied by the caller.
 */
public interface EntityRepository<T> {

    EntityType entityType();

    List<T> fetchAll();

    Optional<RemoteEntity<T>> findByKey(String key);

    RemoteEntity<T> create(T input);

    RemoteEntity<T> update(String id, T input);
}
