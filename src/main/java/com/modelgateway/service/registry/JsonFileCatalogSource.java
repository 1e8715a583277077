package com.modelgateway.service.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelgateway.exception.InvalidCatalogException;
import com.modelgateway.model.ModelDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Catalog read from a JSON array of model descriptors. The file is re-read on
 * every load, so editing it and triggering a reload swaps the catalog.
 */
@Slf4j
public class JsonFileCatalogSource implements CatalogSource {

    private static final TypeReference<List<ModelDescriptor>> CATALOG_TYPE = new TypeReference<>() {
    };

    private final Path location;
    private final ObjectMapper objectMapper;

    public JsonFileCatalogSource(Path location, ObjectMapper objectMapper) {
        this.location = location;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ModelDescriptor> load() {
        try {
            List<ModelDescriptor> models = objectMapper.readValue(Files.readAllBytes(location), CATALOG_TYPE);
            log.debug("Read {} models from {}", models.size(), location);
            return models;
        } catch (IOException e) {
            throw new InvalidCatalogException("Failed to read catalog from " + location, e);
        }
    }

    @Override
    public String describe() {
        return location.toString();
    }
}
