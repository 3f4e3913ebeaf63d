package com.storesync.reconcile.service;

import com.storesync.diff.comparator.ProductTypeComparator;
import com.storesync.domain.ProductType;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.EntityRepository;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.ReconciliationSupport;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ProductTypeService extends ReconciliationService<ProductType> {

    public ProductTypeService(EntityRepository<ProductType> repository, ReconciliationSupport support) {
        super(repository, new ProductTypeComparator(), support);
    }

    @Override
    public List<ProductType> sectionOf(StoreConfig config) {
        return config.getProductTypes();
    }

    @Override
    protected void validate(ProductType input) {
        require(input.getName(), "name");
    }
}
