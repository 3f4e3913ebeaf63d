package com.storesync.desired;

import com.storesync.common.StoreSyncException;
import com.storesync.common.ValidationException;
import com.storesync.domain.Attribute;
import com.storesync.domain.StoreConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DesiredConfigLoaderTest {

    @TempDir
    Path dir;

    private final DesiredConfigLoader loader = new DesiredConfigLoader();

    @Test
    void loadsAllSections() throws Exception {
        Path file = Files.writeString(dir.resolve("config.yml"), """
                channels:
                  - slug: default-channel
                    name: Default Channel
                    currencyCode: USD
                    defaultCountry: US
                    isActive: true
                warehouses:
                  - slug: main
                    name: Main Warehouse
                    country: US
                attributes:
                  - name: Color
                    inputType: DROPDOWN
                    values: [Red, Blue]
                productTypes:
                  - name: T-Shirt
                    isShippingRequired: true
                    productAttributes: [Color]
                categories:
                  - slug: apparel
                    name: Apparel
                  - slug: shirts
                    name: Shirts
                    parent: apparel
                products:
                  - slug: basic-tee
                    name: Basic Tee
                    productType: T-Shirt
                    category: shirts
                """);

        StoreConfig config = loader.load(file);

        assertThat(config.getChannels()).singleElement().satisfies(c -> {
            assertThat(c.getSlug()).isEqualTo("default-channel");
            assertThat(c.getIsActive()).isTrue();
        });
        assertThat(config.getWarehouses().get(0).getCountry()).isEqualTo("US");
        assertThat(config.getAttributes()).containsExactly(new Attribute("Color", "DROPDOWN", List.of("Red", "Blue")));
        assertThat(config.getProductTypes().get(0).getProductAttributes()).containsExactly("Color");
        assertThat(config.getProductTypes().get(0).getVariantAttributes()).isNull();
        assertThat(config.getCategories().get(1).getParent()).isEqualTo("apparel");
        assertThat(config.getProducts().get(0).getCategory()).isEqualTo("shirts");
    }

    @Test
    void missingSections_readAsEmpty() throws Exception {
        Path file = Files.writeString(dir.resolve("config.yml"), """
                channels:
                  - slug: default-channel
                    name: Default
                    currencyCode: USD
                    defaultCountry: US
                """);

        StoreConfig config = loader.load(file);

        assertThat(config.getProducts()).isEmpty();
        assertThat(config.getCategories()).isEmpty();
    }

    @Test
    void emptyFile_isEmptyConfig() throws Exception {
        Path file = Files.writeString(dir.resolve("config.yml"), "");

        assertThat(loader.load(file).getChannels()).isEmpty();
    }

    @Test
    void unknownKey_isValidationError() throws Exception {
        Path file = Files.writeString(dir.resolve("config.yml"), """
                channels:
                  - slug: default-channel
                    currency: USD
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getField()).isEqualTo("currency"))
                .hasMessageContaining("Unknown key 'currency'");
    }

    @Test
    void missingFile_isValidationError() {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Configuration file not found");
    }

    @Test
    void malformedYaml_isParseError() throws Exception {
        Path file = Files.writeString(dir.resolve("config.yml"), "channels: [unclosed");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(StoreSyncException.class)
                .isNotInstanceOf(ValidationException.class)
                .hasMessageContaining("Failed to parse configuration");
    }
}
