package com.storesync.reconcile.service;

import com.storesync.diff.comparator.CategoryComparator;
import com.storesync.domain.Category;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.EntityRepository;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.ReconciliationSupport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Categories reference their parent by slug. A parent in the same batch is always reconciled
 * before its children; a parent outside the batch must already exist remotely.
 */
@Service
public class CategoryService extends ReconciliationService<Category> {

    public CategoryService(EntityRepository<Category> repository, ReconciliationSupport support) {
        super(repository, new CategoryComparator(), support);
    }

    @Override
    public List<Category> sectionOf(StoreConfig config) {
        return config.getCategories();
    }

    @Override
    protected void validate(Category input) {
        require(input.getSlug(), "slug");
        require(input.getName(), "name");
    }

    @Override
    protected List<List<Category>> dependencyLevels(List<Category> inputs) {
        Set<String> inBatch = new HashSet<>();
        for (Category c : inputs) {
            inBatch.add(c.getSlug());
        }
        List<List<Category>> levels = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<Category> remaining = new ArrayList<>(inputs);
        while (!remaining.isEmpty()) {
            List<Category> level = new ArrayList<>();
            for (Category c : remaining) {
                String parent = c.getParent();
                if (parent == null || !inBatch.contains(parent) || placed.contains(parent)) {
                    level.add(c);
                }
            }
            if (level.isEmpty()) {
                // parent cycle: let the remote side reject what it cannot resolve
                level.addAll(remaining);
            }
            remaining.removeAll(level);
            for (Category c : level) {
                placed.add(c.getSlug());
            }
            levels.add(level);
        }
        return levels;
    }
}
