package com.storesync.diff;

import com.storesync.common.ValidationException;
import com.storesync.domain.EntityType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Key-matching diff shared by all families. Entities are matched by natural key; only declared
 * fields are compared, and a field left null in the desired entity is not a change.
 */
public abstract class AbstractEntityComparator<T> implements EntityComparator<T> {

    private final EntityType entityType;
    private final Function<T, String> keyExtractor;
    private final Function<T, String> nameExtractor;
    private final List<FieldSpec<T>> fields;

    /** For families whose natural key is also their display name. */
    protected AbstractEntityComparator(EntityType entityType, Function<T, String> keyExtractor, List<FieldSpec<T>> fields) {
        this(entityType, keyExtractor, keyExtractor, fields);
    }

    protected AbstractEntityComparator(EntityType entityType, Function<T, String> keyExtractor,
                                       Function<T, String> nameExtractor, List<FieldSpec<T>> fields) {
        this.entityType = entityType;
        this.keyExtractor = keyExtractor;
        this.nameExtractor = nameExtractor;
        this.fields = List.copyOf(fields);
    }

    @Override
    public EntityType entityType() {
        return entityType;
    }

    @Override
    public String keyOf(T entity) {
        return keyExtractor.apply(entity);
    }

    @Override
    public List<DiffResult> compare(List<T> desired, List<T> current) {
        Map<String, T> desiredByKey = indexByKey(desired, "desired");
        Map<String, T> currentByKey = indexByKey(current, "current");
        List<DiffResult> results = new ArrayList<>();
        for (Map.Entry<String, T> e : desiredByKey.entrySet()) {
            T existing = currentByKey.get(e.getKey());
            if (existing == null) {
                results.add(DiffResult.create(entityType, e.getKey(), nameOf(e.getKey(), e.getValue()), e.getValue()));
                continue;
            }
            List<DiffChange> changes = changedFields(existing, e.getValue());
            if (!changes.isEmpty()) {
                results.add(DiffResult.update(entityType, e.getKey(), nameOf(e.getKey(), e.getValue()), existing,
                        e.getValue(), changes));
            }
        }
        for (Map.Entry<String, T> e : currentByKey.entrySet()) {
            if (!desiredByKey.containsKey(e.getKey())) {
                results.add(DiffResult.delete(entityType, e.getKey(), nameOf(e.getKey(), e.getValue()), e.getValue()));
            }
        }
        return results;
    }

    // unnamed entities fall back to their key
    private String nameOf(String key, T entity) {
        String name = nameExtractor.apply(entity);
        return name == null || name.isBlank() ? key : name;
    }

    /**
     * Declared fields whose desired value differs from the current one.
     */
    protected List<DiffChange> changedFields(T current, T desired) {
        List<DiffChange> changes = new ArrayList<>();
        for (FieldSpec<T> field : fields) {
            Object want = field.getter().apply(desired);
            if (want == null) {
                continue;
            }
            Object have = field.getter().apply(current);
            if (!valuesEqual(have, want, field.unordered())) {
                changes.add(new DiffChange(field.name(), have, want, describe(field.name(), have, want)));
            }
        }
        return changes;
    }

    private Map<String, T> indexByKey(List<T> entities, String side) {
        Map<String, T> byKey = new LinkedHashMap<>();
        if (entities == null) {
            return byKey;
        }
        for (T entity : entities) {
            if (entity == null) {
                throw new ValidationException(entityType.getDisplayName() + ": null entry in " + side + " configuration");
            }
            String key = keyExtractor.apply(entity);
            if (key == null || key.isBlank()) {
                throw new ValidationException(entityType.getDisplayName() + ": entity without identifier in "
                        + side + " configuration", "key");
            }
            if (byKey.putIfAbsent(key, entity) != null) {
                throw new ValidationException("Duplicate " + entityType.getDisplayName() + " identifier '" + key
                        + "' in " + side + " configuration", "key");
            }
        }
        return byKey;
    }

    private static boolean valuesEqual(Object have, Object want, boolean unordered) {
        if (unordered && have instanceof Collection<?> a && want instanceof Collection<?> b) {
            return a.size() == b.size() && new HashSet<>(a).equals(new HashSet<>(b));
        }
        if (unordered && have == null && want instanceof Collection<?> b) {
            return b.isEmpty();
        }
        return Objects.equals(have, want);
    }

    static String describe(String field, Object have, Object want) {
        return field + ": " + render(have) + " -> " + render(want);
    }

    private static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Collection<?> c) {
            return c.toString();
        }
        return "\"" + value + "\"";
    }

    /**
     * A compared field.
     *
     * @param unordered collections compared as sets
     */
    public record FieldSpec<T>(String name, Function<T, Object> getter, boolean unordered) {

        public static <T> FieldSpec<T> of(String name, Function<T, Object> getter) {
            return new FieldSpec<>(name, getter, false);
        }

        public static <T> FieldSpec<T> unordered(String name, Function<T, Object> getter) {
            return new FieldSpec<>(name, getter, true);
        }
    }
}
