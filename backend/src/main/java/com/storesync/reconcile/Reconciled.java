package com.storesync.reconcile;

import com.storesync.domain.RemoteEntity;

/**
 * Result of reconciling one entity.
 */
public record Reconciled<T>(String key, ReconcileAction action, RemoteEntity<T> remote) {
}
