package com.storesync.desired;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.storesync.common.StoreSyncException;
import com.storesync.common.ValidationException;
import com.storesync.domain.StoreConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the desired store configuration from a YAML file. Unknown keys are rejected so that typos
 * do not silently drop fields.
 */
@Slf4j
public class DesiredConfigLoader {

    private final ObjectMapper mapper;

    public DesiredConfigLoader() {
        mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public StoreConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ValidationException("Configuration file not found: " + path, "config");
        }
        try {
            JsonNode tree = mapper.readTree(path.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                log.warn("Configuration file {} is empty", path);
                return StoreConfig.empty();
            }
            StoreConfig config = mapper.treeToValue(tree, StoreConfig.class);
            log.info("Loaded configuration from {}: {} channel(s), {} warehouse(s), {} attribute(s), "
                            + "{} product type(s), {} categor(ies), {} product(s)", path,
                    config.getChannels().size(), config.getWarehouses().size(), config.getAttributes().size(),
                    config.getProductTypes().size(), config.getCategories().size(), config.getProducts().size());
            return config;
        } catch (UnrecognizedPropertyException e) {
            throw new ValidationException("Unknown key '" + e.getPropertyName() + "' in " + path, e.getPropertyName());
        } catch (IOException e) {
            throw new StoreSyncException("Failed to parse configuration " + path + ": " + e.getMessage(), e);
        }
    }
}
