package com.storesync.diff.comparator;

import com.storesync.diff.AbstractEntityComparator;
import com.storesync.domain.EntityType;
import com.storesync.domain.ProductType;

import java.util.List;

public class ProductTypeComparator extends AbstractEntityComparator<ProductType> {

    public ProductTypeComparator() {
        super(EntityType.PRODUCT_TYPES, ProductType::getName, List.of(
                FieldSpec.of("isShippingRequired", ProductType::getIsShippingRequired),
                FieldSpec.unordered("productAttributes", ProductType::getProductAttributes),
                FieldSpec.unordered("variantAttributes", ProductType::getVariantAttributes)));
    }
}
