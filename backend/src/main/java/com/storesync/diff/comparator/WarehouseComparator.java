package com.storesync.diff.comparator;

import com.storesync.diff.AbstractEntityComparator;
import com.storesync.domain.EntityType;
import com.storesync.domain.Warehouse;

import java.util.List;

public class WarehouseComparator extends AbstractEntityComparator<Warehouse> {

    public WarehouseComparator() {
        super(EntityType.WAREHOUSES, Warehouse::getSlug, Warehouse::getName, List.of(
                FieldSpec.of("name", Warehouse::getName),
                FieldSpec.of("email", Warehouse::getEmail),
                FieldSpec.of("streetAddress1", Warehouse::getStreetAddress1),
                FieldSpec.of("city", Warehouse::getCity),
                FieldSpec.of("postalCode", Warehouse::getPostalCode),
                FieldSpec.of("country", Warehouse::getCountry)));
    }
}
