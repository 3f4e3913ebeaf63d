package com.storesync.reconcile;

public enum ReconcileAction {
    CREATED,
    UPDATED,
    UNCHANGED
}
