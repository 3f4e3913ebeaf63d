package com.storesync.diff;

/**
 * One differing field of an UPDATE.
 */
public record DiffChange(String field, Object currentValue, Object desiredValue, String description) {
}
