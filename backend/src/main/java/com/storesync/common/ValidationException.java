package com.storesync.common;

/**
 * Input rejected before any remote call: missing required field, blank or duplicate key.
 */
public class ValidationException extends StoreSyncException {

    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
