package com.storesync.reconcile.service;

import com.storesync.diff.comparator.WarehouseComparator;
import com.storesync.domain.StoreConfig;
import com.storesync.domain.Warehouse;
import com.storesync.reconcile.EntityRepository;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.ReconciliationSupport;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Warehouses need a slug, a name and a country; the remaining address fields are optional.
 */
@Service
public class WarehouseService extends ReconciliationService<Warehouse> {

    public WarehouseService(EntityRepository<Warehouse> repository, ReconciliationSupport support) {
        super(repository, new WarehouseComparator(), support);
    }

    @Override
    public List<Warehouse> sectionOf(StoreConfig config) {
        return config.getWarehouses();
    }

    @Override
    protected void validate(Warehouse input) {
        require(input.getSlug(), "slug");
        require(input.getName(), "name");
        require(input.getCountry(), "country");
    }
}
