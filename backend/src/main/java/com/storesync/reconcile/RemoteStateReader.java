package com.storesync.reconcile;

import com.storesync.common.CancellationToken;
import com.storesync.domain.EntityType;
import com.storesync.domain.StoreConfig;
import com.storesync.reconcile.service.AttributeService;
import com.storesync.reconcile.service.CategoryService;
import com.storesync.reconcile.service.ChannelService;
import com.storesync.reconcile.service.ProductService;
import com.storesync.reconcile.service.ProductTypeService;
import com.storesync.reconcile.service.WarehouseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads the current remote configuration, one family after another, into a {@link StoreConfig}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteStateReader {

    private final ChannelService channelService;
    private final WarehouseService warehouseService;
    private final AttributeService attributeService;
    private final ProductTypeService productTypeService;
    private final CategoryService categoryService;
    private final ProductService productService;

    public StoreConfig read(CancellationToken token) {
        return read(EnumSet.allOf(EntityType.class), token);
    }

    /** Families not in {@code include} are left empty. */
    public StoreConfig read(Set<EntityType> include, CancellationToken token) {
        StoreConfig current = new StoreConfig();
        if (include.contains(EntityType.CHANNELS)) {
            current.setChannels(channelService.fetchCurrent(token));
        }
        if (include.contains(EntityType.WAREHOUSES)) {
            current.setWarehouses(warehouseService.fetchCurrent(token));
        }
        if (include.contains(EntityType.ATTRIBUTES)) {
            current.setAttributes(attributeService.fetchCurrent(token));
        }
        if (include.contains(EntityType.PRODUCT_TYPES)) {
            current.setProductTypes(productTypeService.fetchCurrent(token));
        }
        if (include.contains(EntityType.CATEGORIES)) {
            current.setCategories(categoryService.fetchCurrent(token));
        }
        if (include.contains(EntityType.PRODUCTS)) {
            current.setProducts(productService.fetchCurrent(token));
        }
        log.info("Remote configuration read for {}", include);
        return current;
    }

    /** Services by entity type, in deployment order. */
    public Map<EntityType, ReconciliationService<?>> services() {
        Map<EntityType, ReconciliationService<?>> byType = new LinkedHashMap<>();
        byType.put(EntityType.CHANNELS, channelService);
        byType.put(EntityType.WAREHOUSES, warehouseService);
        byType.put(EntityType.ATTRIBUTES, attributeService);
        byType.put(EntityType.PRODUCT_TYPES, productTypeService);
        byType.put(EntityType.CATEGORIES, categoryService);
        byType.put(EntityType.PRODUCTS, productService);
        return byType;
    }
}
