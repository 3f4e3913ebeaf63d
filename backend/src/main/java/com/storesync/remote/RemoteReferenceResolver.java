package com.storesync.remote;

import com.storesync.common.ValidationException;
import com.storesync.domain.EntityType;
import com.storesync.domain.RemoteEntity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves references through the registered repositories, which answer from their cached listings.
 */
public class RemoteReferenceResolver implements ReferenceResolver {

    private final Map<EntityType, GraphQLEntityRepository<?>> repositories = new EnumMap<>(EntityType.class);

    public void register(GraphQLEntityRepository<?> repository) {
        repositories.put(repository.entityType(), repository);
    }

    @Override
    public String requireId(EntityType type, String key) {
        GraphQLEntityRepository<?> repository = repositories.get(type);
        if (repository == null) {
            throw new IllegalStateException("No repository registered for " + type);
        }
        return repository.findByKey(key)
                .map(RemoteEntity::id)
                .orElseThrow(() -> new ValidationException(
                        type.getDisplayName() + " '" + key + "' referenced but not found remotely", key));
    }
}
