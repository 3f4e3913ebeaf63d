package com.storesync.diff;

public enum DiffOperation {
    CREATE,
    UPDATE,
    DELETE
}
