package com.storesync.diff.comparator;

import com.storesync.diff.AbstractEntityComparator;
import com.storesync.domain.EntityType;
import com.storesync.domain.Product;

import java.util.List;

/**
 * Products reference their type by name and their category by slug.
 */
public class ProductComparator extends AbstractEntityComparator<Product> {

    public ProductComparator() {
        super(EntityType.PRODUCTS, Product::getSlug, Product::getName, List.of(
                FieldSpec.of("name", Product::getName),
                FieldSpec.of("description", Product::getDescription),
                FieldSpec.of("productType", Product::getProductType),
                FieldSpec.of("category", Product::getCategory)));
    }
}
