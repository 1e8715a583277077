package com.modelgateway.service.registry;

import com.modelgateway.exception.InvalidCatalogException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.ModelDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Immutable, fully indexed view of the model catalog.
 *
 * Built completely before it is published, so readers holding a reference
 * never observe a partially loaded catalog.
 */
public final class CatalogSnapshot {

    private final long version;
    private final Instant loadedAt;
    private final Map<String, ModelDescriptor> byId;
    private final Map<Capability, List<ModelDescriptor>> byCapability;

    private CatalogSnapshot(long version, Instant loadedAt,
                            Map<String, ModelDescriptor> byId,
                            Map<Capability, List<ModelDescriptor>> byCapability) {
        this.version = version;
        this.loadedAt = loadedAt;
        this.byId = byId;
        this.byCapability = byCapability;
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(0, Instant.EPOCH, Map.of(), Map.of());
    }

    /**
     * Validate and index a complete catalog.
     *
     * @throws InvalidCatalogException on missing fields or duplicate ids
     */
    public static CatalogSnapshot build(long version, Instant loadedAt, Collection<ModelDescriptor> models) {
        Map<String, ModelDescriptor> byId = new LinkedHashMap<>();
        Map<Capability, List<ModelDescriptor>> byCapability = new EnumMap<>(Capability.class);

        // Stable iteration order regardless of source ordering
        List<ModelDescriptor> sorted = new ArrayList<>(models);
        sorted.sort(Comparator.comparing(ModelDescriptor::getId, Comparator.nullsFirst(Comparator.naturalOrder())));

        for (ModelDescriptor model : sorted) {
            validate(model);
            if (byId.putIfAbsent(model.getId(), model) != null) {
                throw new InvalidCatalogException("Duplicate model id: " + model.getId());
            }
            for (Capability capability : model.getCapabilities()) {
                byCapability.computeIfAbsent(capability, c -> new ArrayList<>()).add(model);
            }
        }

        Map<Capability, List<ModelDescriptor>> frozen = new EnumMap<>(Capability.class);
        byCapability.forEach((capability, list) -> frozen.put(capability, List.copyOf(list)));

        return new CatalogSnapshot(version, loadedAt,
                Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(frozen));
    }

    private static void validate(ModelDescriptor model) {
        if (model.getId() == null || model.getId().isBlank()) {
            throw new InvalidCatalogException("Model id is required");
        }
        if (model.getProvider() == null || model.getProvider().isBlank()) {
            throw new InvalidCatalogException("Provider is required for model " + model.getId());
        }
        if (model.getCapabilities().isEmpty()) {
            throw new InvalidCatalogException("Model " + model.getId() + " declares no capabilities");
        }
        if (model.getMaxContextTokens() <= 0) {
            throw new InvalidCatalogException("Model " + model.getId() + " must declare a positive context length");
        }
        if (model.getInputCostPer1k() < 0 || model.getOutputCostPer1k() < 0) {
            throw new InvalidCatalogException("Model " + model.getId() + " has a negative cost");
        }
    }

    public long getVersion() {
        return version;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public Optional<ModelDescriptor> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<ModelDescriptor> all() {
        return List.copyOf(byId.values());
    }

    /**
     * Enabled models offering the capability.
     */
    public List<ModelDescriptor> list(Capability capability) {
        return byCapability.getOrDefault(capability, List.of()).stream()
                .filter(ModelDescriptor::isEnabled)
                .toList();
    }

    /**
     * Enabled models offering every one of the capabilities. An empty set matches
     * every enabled model.
     */
    public List<ModelDescriptor> list(Collection<Capability> required) {
        if (required.isEmpty()) {
            return byId.values().stream().filter(ModelDescriptor::isEnabled).toList();
        }
        // Scan the smallest index bucket
        Capability narrowest = required.stream()
                .min(Comparator.comparingInt(c -> byCapability.getOrDefault(c, List.of()).size()))
                .orElseThrow();
        return list(narrowest).stream()
                .filter(model -> model.supports(required))
                .toList();
    }

    public List<ModelDescriptor> byProvider(String provider) {
        return byId.values().stream()
                .filter(model -> model.getProvider().equals(provider))
                .toList();
    }

    public List<String> providers() {
        return List.copyOf(new TreeSet<>(byId.values().stream().map(ModelDescriptor::getProvider).toList()));
    }

    public List<Capability> capabilities() {
        return List.copyOf(byCapability.keySet());
    }

    public int size() {
        return byId.size();
    }
}
