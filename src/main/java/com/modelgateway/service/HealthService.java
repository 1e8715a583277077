package com.modelgateway.service;

import com.modelgateway.model.CircuitState;
import com.modelgateway.model.HealthStatus;
import com.modelgateway.model.dto.CatalogSummary;
import com.modelgateway.model.dto.CircuitStatus;
import com.modelgateway.model.dto.HealthReport;
import com.modelgateway.model.dto.HealthReport.ComponentHealth;
import com.modelgateway.model.dto.QueueStatistics;
import com.modelgateway.provider.ProviderAdapter;
import com.modelgateway.provider.ProviderAdapterRegistry;
import com.modelgateway.service.cache.SemanticCache;
import com.modelgateway.service.circuit.CircuitBreaker;
import com.modelgateway.service.queue.RequestQueue;
import com.modelgateway.service.registry.CatalogSnapshot;
import com.modelgateway.service.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregates component state into a gateway health report.
 *
 * registry  DOWN when the catalog is empty
 * adapters  DOWN when no catalog provider has an enabled adapter, DEGRADED when some lack one
 * circuits  DOWN when every catalog provider is open, DEGRADED when any is
 * queue     DEGRADED at capacity
 * cache     always UP, reported for its statistics
 *
 * The overall status is the worst component status. The gateway is ready when
 * at least one catalog provider has an enabled adapter and an available circuit.
 */
@Slf4j
@Service
public class HealthService {

    private final ModelRegistry registry;
    private final SemanticCache cache;
    private final RequestQueue queue;
    private final CircuitBreaker circuitBreaker;
    private final ProviderAdapterRegistry adapters;
    private final Clock clock;
    private final Instant startedAt;

    public HealthService(ModelRegistry registry,
                         SemanticCache cache,
                         RequestQueue queue,
                         CircuitBreaker circuitBreaker,
                         ProviderAdapterRegistry adapters,
                         Clock clock) {
        this.registry = registry;
        this.cache = cache;
        this.queue = queue;
        this.circuitBreaker = circuitBreaker;
        this.adapters = adapters;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public HealthReport summary() {
        HealthReport detailed = detailed();
        return HealthReport.builder()
                .status(detailed.getStatus())
                .timestamp(detailed.getTimestamp())
                .uptime(detailed.getUptime())
                .build();
    }

    public boolean isReady() {
        CatalogSnapshot snapshot = registry.snapshot();
        return snapshot.providers().stream()
                .anyMatch(provider -> adapterEnabled(provider) && circuitBreaker.isAvailable(provider));
    }

    public HealthReport detailed() {
        Instant now = clock.instant();
        CatalogSnapshot snapshot = registry.snapshot();
        List<String> providers = snapshot.providers();
        providers.forEach(circuitBreaker::getStatus);
        List<CircuitStatus> circuits = circuitBreaker.getStatuses();
        QueueStatistics queueStatistics = queue.statistics();

        Map<String, Boolean> adapterStates = new TreeMap<>();
        for (ProviderAdapter adapter : adapters.getAdapters()) {
            adapterStates.put(adapter.getName(), adapter.isEnabled());
        }

        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        components.put("registry", registryHealth(snapshot));
        components.put("adapters", adapterHealth(providers));
        components.put("circuits", circuitHealth(providers));
        components.put("queue", queueHealth(queueStatistics));
        components.put("cache", component(HealthStatus.UP, cache.size() + " entries"));

        HealthStatus overall = components.values().stream()
                .map(ComponentHealth::getStatus)
                .reduce(HealthStatus.UP, HealthStatus::worst);
        if (overall != HealthStatus.UP) {
            log.debug("Gateway health is {}: {}", overall, components);
        }

        return HealthReport.builder()
                .status(overall)
                .timestamp(now)
                .uptime(Duration.between(startedAt, now))
                .components(components)
                .catalog(CatalogSummary.builder()
                        .version(snapshot.getVersion())
                        .loadedAt(snapshot.getLoadedAt())
                        .models(snapshot.size())
                        .providers(providers)
                        .capabilities(snapshot.capabilities())
                        .build())
                .cache(cache.getStatistics())
                .queue(queueStatistics)
                .circuits(circuits)
                .adapters(adapterStates)
                .build();
    }

    private ComponentHealth registryHealth(CatalogSnapshot snapshot) {
        if (snapshot.size() == 0) {
            return component(HealthStatus.DOWN, "catalog is empty");
        }
        return component(HealthStatus.UP, snapshot.size() + " models, version " + snapshot.getVersion());
    }

    private ComponentHealth adapterHealth(List<String> providers) {
        List<String> missing = providers.stream().filter(provider -> !adapterEnabled(provider)).toList();
        if (providers.isEmpty() || missing.size() == providers.size()) {
            return component(HealthStatus.DOWN, "no catalog provider has an enabled adapter");
        }
        if (!missing.isEmpty()) {
            return component(HealthStatus.DEGRADED, "no enabled adapter for " + missing);
        }
        return component(HealthStatus.UP, providers.size() + " providers enabled");
    }

    private ComponentHealth circuitHealth(List<String> providers) {
        List<String> open = providers.stream()
                .filter(provider -> circuitBreaker.getState(provider) == CircuitState.OPEN)
                .toList();
        if (!providers.isEmpty() && open.size() == providers.size()) {
            return component(HealthStatus.DOWN, "all circuits open");
        }
        if (!open.isEmpty()) {
            return component(HealthStatus.DEGRADED, "open: " + open);
        }
        return component(HealthStatus.UP, null);
    }

    private static ComponentHealth queueHealth(QueueStatistics statistics) {
        if (statistics.getDepth() >= statistics.getMaxDepth()) {
            return component(HealthStatus.DEGRADED, "queue full at " + statistics.getDepth());
        }
        return component(HealthStatus.UP, statistics.getDepth() + "/" + statistics.getMaxDepth() + " queued");
    }

    private boolean adapterEnabled(String provider) {
        Optional<ProviderAdapter> adapter = adapters.find(provider);
        return adapter.isPresent() && adapter.get().isEnabled();
    }

    private static ComponentHealth component(HealthStatus status, String detail) {
        return ComponentHealth.builder().status(status).detail(detail).build();
    }
}
