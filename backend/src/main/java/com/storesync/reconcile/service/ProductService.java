package com.storesync.reconcile.service;

import com.storesync.diff.comparator.ProductComparator;
import com.storesync.domain.Product;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.EntityRepository;
import com.storesync.reconcile.ReconciliationService;
import com.storesync.reconcile.ReconciliationSupport;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ProductService extends ReconciliationService<Product> {

    public ProductService(EntityRepository<Product> repository, ReconciliationSupport support) {
        super(repository, new ProductComparator(), support);
    }

    @Override
    public List<Product> sectionOf(StoreConfig config) {
        return config.getProducts();
    }

    @Override
    protected void validate(Product input) {
        require(input.getSlug(), "slug");
        require(input.getName(), "name");
        require(input.getProductType(), "productType");
        require(input.getCategory(), "category");
    }
}
