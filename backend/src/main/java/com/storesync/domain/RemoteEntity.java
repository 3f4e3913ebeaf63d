package com.storesync.domain;

/**
 * An entity as it exists remotely, with its server-assigned id.
 */
public record RemoteEntity<T>(String id, T entity) {
}
