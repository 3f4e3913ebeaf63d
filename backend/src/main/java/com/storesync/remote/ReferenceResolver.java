package com.storesync.remote;

import com.storesync.domain.EntityType;

/**
 * Turns a natural key of another family (attribute name, category slug, ...) into its remote id.
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * @throws com.storesync.common.ValidationException when no remote entity has that key
     */
    String requireId(EntityType type, String key);
}
