package com.modelgateway.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Looks up the adapter for a catalog provider name.
 */
@Slf4j
@Component
public class ProviderAdapterRegistry {

    private final Map<String, ProviderAdapter> adapters = new TreeMap<>();

    public ProviderAdapterRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.getName(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider adapter: " + adapter.getName());
            }
        }
        log.info("Initialized ProviderAdapterRegistry with {} adapters: {}",
                this.adapters.size(), this.adapters.keySet());
    }

    public Optional<ProviderAdapter> find(String provider) {
        return Optional.ofNullable(adapters.get(provider));
    }

    public Collection<ProviderAdapter> getAdapters() {
        return Collections.unmodifiableCollection(adapters.values());
    }
}
