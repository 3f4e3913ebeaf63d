package com.storesync.batch;

public record ItemFailure<T>(T item, RuntimeException error) {

    public String message() {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
