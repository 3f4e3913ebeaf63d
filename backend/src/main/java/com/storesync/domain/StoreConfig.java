package com.storesync.domain;

import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Whole store configuration: the desired state loaded from YAML, or the current state read remotely.
 * Missing sections read as empty lists.
 */
@NoArgsConstructor
@Setter
public class StoreConfig {

    private List<Channel> channels;
    private List<Warehouse> warehouses;
    private List<Attribute> attributes;
    private List<ProductType> productTypes;
    private List<Category> categories;
    private List<Product> products;

    public List<Channel> getChannels() {
        return orEmpty(channels);
    }

    public List<Warehouse> getWarehouses() {
        return orEmpty(warehouses);
    }

    public List<Attribute> getAttributes() {
        return orEmpty(attributes);
    }

    public List<ProductType> getProductTypes() {
        return orEmpty(productTypes);
    }

    public List<Category> getCategories() {
        return orEmpty(categories);
    }

    public List<Product> getProducts() {
        return orEmpty(products);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    public static StoreConfig empty() {
        return new StoreConfig();
    }
}
