package com.storesync.domain;

/**
 * Entity families in deployment order: referenced families come before the ones referencing them.
 */
public enum EntityType {

    CHANNELS("Channels", "channels"),
    WAREHOUSES("Warehouses", "warehouses"),
    ATTRIBUTES("Attributes", "attributes"),
    PRODUCT_TYPES("Product Types", "productTypes"),
    CATEGORIES("Categories", "categories"),
    PRODUCTS("Products", "products");

    private final String displayName;
    private final String configKey;

    EntityType(String displayName, String configKey) {
        this.displayName = displayName;
        this.configKey = configKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Section name in the YAML configuration. */
    public String getConfigKey() {
        return configKey;
    }

    public String getStageName() {
        return "Managing " + displayName.toLowerCase();
    }

    /**
     * Resolves a section name ("productTypes"), enum name ("PRODUCT_TYPES") or
     * display name ("product types"), case-insensitive.
     */
    public static EntityType fromName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Entity type must not be null");
        }
        String v = value.trim();
        for (EntityType type : values()) {
            if (type.name().equalsIgnoreCase(v) || type.configKey.equalsIgnoreCase(v)
                    || type.displayName.equalsIgnoreCase(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
