package com.modelgateway.service.registry;

import com.modelgateway.model.ModelDescriptor;

import java.util.List;

/**
 * Supplies complete catalogs to the registry. Implementations may read
 * configuration, a file, a database or a control plane; each call returns the
 * full catalog, never a delta.
 */
public interface CatalogSource {

    /**
     * Load the complete catalog.
     *
     * @return every model descriptor, enabled or not
     */
    List<ModelDescriptor> load();

    /**
     * Human readable description for logs.
     */
    String describe();
}
