package com.modelgateway.service.registry;

import com.modelgateway.exception.ModelNotFoundException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.ModelDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Catalog of known (provider, model) pairs.
 *
 * Reads go through an atomically swapped {@link CatalogSnapshot}; a reload
 * builds and validates the new snapshot completely before publishing it, and a
 * failed reload leaves the current snapshot in place.
 */
@Slf4j
public class ModelRegistry {

    private final CatalogSource source;
    private final Clock clock;
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.empty());

    public ModelRegistry(CatalogSource source, Clock clock) {
        this.source = source;
        this.clock = clock;
    }

    /**
     * Pull a complete catalog from the source and swap it in.
     *
     * @return the published snapshot
     */
    public CatalogSnapshot reload() {
        CatalogSnapshot previous = current.get();
        CatalogSnapshot next = CatalogSnapshot.build(previous.getVersion() + 1, clock.instant(), source.load());
        publish(next);
        return next;
    }

    /**
     * Swap in a catalog pushed by a control plane.
     */
    public CatalogSnapshot replace(List<ModelDescriptor> models) {
        CatalogSnapshot next = CatalogSnapshot.build(current.get().getVersion() + 1, clock.instant(), models);
        publish(next);
        return next;
    }

    private void publish(CatalogSnapshot next) {
        current.set(next);
        log.info("Loaded model catalog v{} from {}: {} models, providers={}",
                next.getVersion(), source.describe(), next.size(), next.providers());
    }

    /**
     * Current snapshot. Callers that make several reads for one decision should
     * hold on to a single snapshot rather than calling this repeatedly.
     */
    public CatalogSnapshot snapshot() {
        return current.get();
    }

    public List<ModelDescriptor> list(Capability capability) {
        return current.get().list(capability);
    }

    public ModelDescriptor get(String id) {
        return current.get().get(id).orElseThrow(() -> new ModelNotFoundException(id));
    }
}
