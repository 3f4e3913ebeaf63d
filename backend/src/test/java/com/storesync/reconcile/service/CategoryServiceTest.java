package com.storesync.reconcile.service;

import com.storesync.batch.ChunkedBatchProcessor;
import com.storesync.common.CancellationToken;
import com.storesync.common.MutableClock;
import com.storesync.common.RecordingSleeper;
import com.storesync.common.RetryPolicy;
import com.storesync.domain.Category;
import com.storesync.domain.EntityType;
import com.storesync.reconcile.BatchReport;
import com.storesync.reconcile.BatchSettings;
import com.storesync.reconcile.InMemoryRepository;
import com.storesync.reconcile.Reconciled;
import com.storesync.reconcile.ReconciliationSupport;
import com.storesync.resilience.ResilienceContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryServiceTest {

    private final InMemoryRepository<Category> repository = new InMemoryRepository<>(EntityType.CATEGORIES, Category::getSlug);
    private final CategoryService service;

    CategoryServiceTest() {
        MutableClock clock = new MutableClock(0L);
        RecordingSleeper sleeper = new RecordingSleeper(clock);
        service = new CategoryService(repository, new ReconciliationSupport(
                ResilienceContext.create(clock, new RetryPolicy(10L, 2.0, 100L, 0, 1), sleeper),
                new ChunkedBatchProcessor(sleeper), Runnable::run, BatchSettings.defaults()));
    }

    @Test
    void parentsAreCreatedBeforeChildren() {
        List<Category> inputs = List.of(
                new Category("sneakers", "Sneakers", null, "shoes"),
                new Category("shoes", "Shoes", null, "apparel"),
                new Category("apparel", "Apparel", null, null),
                new Category("outlet", "Outlet", null, "existing-root"));

        BatchReport<Category> report = service.bootstrap(inputs, CancellationToken.none());

        assertThat(repository.calls()).filteredOn(c -> c.startsWith("create"))
                .containsExactly("create apparel", "create outlet", "create shoes", "create sneakers");
        // report keeps input order regardless of execution order
        assertThat(report.successes()).extracting(Reconciled::key)
                .containsExactly("sneakers", "shoes", "apparel", "outlet");
    }

    @Test
    void parentCycle_stillAttemptsEveryItem() {
        List<Category> inputs = List.of(
                new Category("a", "A", null, "b"),
                new Category("b", "B", null, "a"));

        BatchReport<Category> report = service.bootstrap(inputs, CancellationToken.none());

        assertThat(report.total()).isEqualTo(2);
    }

    @Test
    void validation_requiresSlugAndName() {
        org.assertj.core.api.Assertions.assertThatThrownBy(() ->
                        service.bootstrap(List.of(new Category("x", " ", null, null)), CancellationToken.none()))
                .hasMessageContaining("name is required");
    }
}
