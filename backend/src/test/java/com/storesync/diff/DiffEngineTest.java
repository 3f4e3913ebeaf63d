package com.storesync.diff;

import com.storesync.common.ValidationException;
import com.storesync.domain.Category;
import com.storesync.domain.Channel;
import com.storesync.domain.EntityType;
import com.storesync.domain.StoreConfig;
import com.storesync.domain.Warehouse;
import com.storesync.diff.comparator.CategoryComparator;
import com.storesync.diff.comparator.ChannelComparator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DiffEngineTest {

    private final DiffEngine engine = new DiffEngine();

    private static Channel channel(String slug, String name, String currency) {
        return new Channel(slug, name, currency, "US", true);
    }

    @Test
    @DisplayName("create, update and delete are detected by natural key")
    void detectsAllOperations() {
        StoreConfig desired = new StoreConfig();
        desired.setChannels(List.of(channel("default", "Default", "USD"), channel("eu", "Europe", "EUR")));
        StoreConfig current = new StoreConfig();
        current.setChannels(List.of(channel("default", "Default", "GBP"), channel("legacy", "Legacy", "USD")));

        DiffSummary summary = engine.diff(desired, current);

        assertThat(summary.totalChanges()).isEqualTo(3);
        assertThat(summary.creates()).isEqualTo(1);
        assertThat(summary.updates()).isEqualTo(1);
        assertThat(summary.deletes()).isEqualTo(1);

        DiffResult update = summary.resultsFor(EntityType.CHANNELS, DiffOperation.UPDATE).get(0);
        assertThat(update.entityKey()).isEqualTo("default");
        assertThat(update.entityName()).isEqualTo("Default");
        assertThat(update.changes()).singleElement().satisfies(c -> {
            assertThat(c.field()).isEqualTo("currencyCode");
            assertThat(c.description()).isEqualTo("currencyCode: \"GBP\" -> \"USD\"");
        });
        assertThat(summary.resultsFor(EntityType.CHANNELS, DiffOperation.CREATE))
                .extracting(DiffResult::entityKey, DiffResult::entityName).containsExactly(tuple("eu", "Europe"));
        assertThat(summary.resultsFor(EntityType.CHANNELS, DiffOperation.DELETE))
                .extracting(DiffResult::entityKey, DiffResult::entityName).containsExactly(tuple("legacy", "Legacy"));
    }

    @Test
    void categoryCreate_reportsDisplayNameAndSlugKey() {
        DiffSummary summary = engine.diff(new CategoryComparator(),
                List.of(new Category("a", "X", null, null)), List.of());

        assertThat(summary.results()).singleElement().satisfies(r -> {
            assertThat(r.operation()).isEqualTo(DiffOperation.CREATE);
            assertThat(r.entityName()).isEqualTo("X");
            assertThat(r.entityKey()).isEqualTo("a");
        });
    }

    @Test
    void identicalConfigs_haveNoChanges() {
        StoreConfig desired = new StoreConfig();
        desired.setChannels(List.of(channel("default", "Default", "USD")));
        StoreConfig current = new StoreConfig();
        current.setChannels(List.of(channel("default", "Default", "USD")));

        assertThat(engine.diff(desired, current).hasChanges()).isFalse();
    }

    @Test
    void nullDesiredField_isNotAChange() {
        StoreConfig desired = new StoreConfig();
        desired.setCategories(List.of(new Category("shoes", "Shoes", null, null)));
        StoreConfig current = new StoreConfig();
        current.setCategories(List.of(new Category("shoes", "Shoes", "All kinds of shoes", "apparel")));

        assertThat(engine.diff(desired, current).hasChanges()).isFalse();
    }

    @Test
    void resultsFollowDeploymentOrder_andAreDeterministic() {
        StoreConfig desired = new StoreConfig();
        desired.setCategories(List.of(new Category("shoes", "Shoes", null, null)));
        desired.setWarehouses(List.of(new Warehouse("main", "Main", null, null, null, null, "US")));
        desired.setChannels(List.of(channel("default", "Default", "USD")));

        DiffSummary first = engine.diff(desired, StoreConfig.empty());
        DiffSummary second = engine.diff(desired, StoreConfig.empty());

        assertThat(first.results()).extracting(DiffResult::entityType)
                .containsExactly(EntityType.CHANNELS, EntityType.WAREHOUSES, EntityType.CATEGORIES);
        assertThat(first).isEqualTo(second);
    }

    @Test
    void includeFilter_limitsComputedTypes() {
        StoreConfig desired = new StoreConfig();
        desired.setChannels(List.of(channel("default", "Default", "USD")));
        desired.setCategories(List.of(new Category("shoes", "Shoes", null, null)));

        DiffSummary summary = engine.diff(desired, StoreConfig.empty(), EnumSet.of(EntityType.CATEGORIES));

        assertThat(summary.results()).extracting(DiffResult::entityType).containsOnly(EntityType.CATEGORIES);
    }

    @Test
    void duplicateDesiredKey_isRejected() {
        StoreConfig desired = new StoreConfig();
        desired.setChannels(List.of(channel("default", "A", "USD"), channel("default", "B", "USD")));

        assertThatThrownBy(() -> engine.diff(desired, StoreConfig.empty()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Duplicate")
                .hasMessageContaining("default");
    }

    @Test
    void singleCollectionDiff_withExplicitComparator() {
        DiffSummary summary = engine.diff(new ChannelComparator(), List.of(channel("a", "A", "USD")), null);

        assertThat(summary.creates()).isEqualTo(1);
    }
}
