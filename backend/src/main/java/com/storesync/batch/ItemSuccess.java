package com.storesync.batch;

public record ItemSuccess<T, R>(T item, R result) {
}
