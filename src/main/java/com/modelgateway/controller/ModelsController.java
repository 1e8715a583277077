package com.modelgateway.controller;

import com.modelgateway.exception.InvalidRequestException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.ModelDescriptor;
import com.modelgateway.service.registry.CatalogSnapshot;
import com.modelgateway.service.registry.ModelRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Read-only view of the model catalog.
 */
@RestController
@RequestMapping("/v1/models")
public class ModelsController {

    private final ModelRegistry registry;

    public ModelsController(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * All catalog entries, or the enabled ones offering {@code capability}.
     */
    @GetMapping
    public Mono<List<ModelDescriptor>> list(@RequestParam(required = false) String capability) {
        CatalogSnapshot snapshot = registry.snapshot();
        if (capability == null || capability.isBlank()) {
            return Mono.just(snapshot.all());
        }
        return Mono.just(snapshot.list(parseCapability(capability)));
    }

    @GetMapping("/{id}")
    public Mono<ModelDescriptor> get(@PathVariable String id) {
        return Mono.fromSupplier(() -> registry.get(id));
    }

    private static Capability parseCapability(String value) {
        try {
            return Capability.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown capability: " + value);
        }
    }
}
