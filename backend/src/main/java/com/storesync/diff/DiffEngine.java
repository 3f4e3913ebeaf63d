package com.storesync.diff;

import com.storesync.diff.comparator.AttributeComparator;
import com.storesync.diff.comparator.CategoryComparator;
import com.storesync.diff.comparator.ChannelComparator;
import com.storesync.diff.comparator.ProductComparator;
import com.storesync.diff.comparator.ProductTypeComparator;
import com.storesync.diff.comparator.WarehouseComparator;
import com.storesync.domain.EntityType;
import com.storesync.domain.StoreConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes the CREATE/UPDATE/DELETE plan between desired and current store configuration.
 * Results come grouped by entity type in deployment order; the same inputs always give the same plan.
 */
@Slf4j
public class DiffEngine {

    private final List<ComparatorBinding<?>> bindings = List.of(
            new ComparatorBinding<>(new ChannelComparator(), StoreConfig::getChannels),
            new ComparatorBinding<>(new WarehouseComparator(), StoreConfig::getWarehouses),
            new ComparatorBinding<>(new AttributeComparator(), StoreConfig::getAttributes),
            new ComparatorBinding<>(new ProductTypeComparator(), StoreConfig::getProductTypes),
            new ComparatorBinding<>(new CategoryComparator(), StoreConfig::getCategories),
            new ComparatorBinding<>(new ProductComparator(), StoreConfig::getProducts));

    public DiffSummary diff(StoreConfig desired, StoreConfig current) {
        return diff(desired, current, EnumSet.allOf(EntityType.class));
    }

    /**
     * Diffs only the given entity types.
     */
    public DiffSummary diff(StoreConfig desired, StoreConfig current, Set<EntityType> include) {
        StoreConfig want = desired != null ? desired : StoreConfig.empty();
        StoreConfig have = current != null ? current : StoreConfig.empty();
        List<DiffResult> results = new ArrayList<>();
        for (ComparatorBinding<?> binding : bindings) {
            if (include.contains(binding.comparator().entityType())) {
                results.addAll(binding.compare(want, have));
            }
        }
        DiffSummary summary = DiffSummary.of(results);
        log.info("Diff computed: {} change(s) ({} create, {} update, {} delete)",
                summary.totalChanges(), summary.creates(), summary.updates(), summary.deletes());
        return summary;
    }

    /** Diffs a single collection with the given comparator. */
    public <T> DiffSummary diff(EntityComparator<T> comparator, List<T> desired, List<T> current) {
        return DiffSummary.of(comparator.compare(desired != null ? desired : List.of(), current != null ? current : List.of()));
    }

    private record ComparatorBinding<T>(EntityComparator<T> comparator, Function<StoreConfig, List<T>> section) {

        List<DiffResult> compare(StoreConfig desired, StoreConfig current) {
            return comparator.compare(section.apply(desired), section.apply(current));
        }
    }
}
