package com.modelgateway.controller;

import com.modelgateway.model.dto.BucketState;
import com.modelgateway.model.dto.CacheStatistics;
import com.modelgateway.model.dto.CatalogSummary;
import com.modelgateway.model.dto.CircuitStatus;
import com.modelgateway.model.dto.QueueStatistics;
import com.modelgateway.service.AdminService;
import com.modelgateway.service.registry.CatalogSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Admin API for gateway introspection and management.
 * Exposes cache, circuit, rate limit and queue state, plus cache clear,
 * circuit reset and registry reload.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final AdminService adminService;

    public AdminController(AdminService adminService) {
        this.adminService = adminService;
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> getCacheStats() {
        return ResponseEntity.ok(adminService.getCacheStatistics());
    }

    /**
     * Clear the semantic cache.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int removed = adminService.clearCache();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "removed", removed
        ));
    }

    /**
     * Circuit state per provider, with time until the next call is allowed.
     */
    @GetMapping("/circuits")
    public ResponseEntity<List<CircuitStatus>> getCircuits() {
        return ResponseEntity.ok(adminService.getCircuits());
    }

    @PostMapping("/circuits/{provider}/reset")
    public ResponseEntity<CircuitStatus> resetCircuit(@PathVariable String provider) {
        return ResponseEntity.ok(adminService.resetCircuit(provider));
    }

    /**
     * Token bucket occupancy per (caller, provider).
     */
    @GetMapping("/rate-limits")
    public ResponseEntity<List<BucketState>> getRateLimits() {
        return ResponseEntity.ok(adminService.getRateLimits());
    }

    @GetMapping("/queue")
    public ResponseEntity<QueueStatistics> getQueue() {
        return ResponseEntity.ok(adminService.getQueueStatistics());
    }

    /**
     * Reload the model catalog. Responds with the newly published catalog; on
     * failure the previous catalog stays active and the error is returned.
     */
    @PostMapping("/registry/reload")
    public ResponseEntity<CatalogSummary> reloadRegistry() {
        CatalogSnapshot snapshot = adminService.reloadRegistry();
        return ResponseEntity.ok(CatalogSummary.builder()
                .version(snapshot.getVersion())
                .loadedAt(snapshot.getLoadedAt())
                .models(snapshot.size())
                .providers(snapshot.providers())
                .capabilities(snapshot.capabilities())
                .build());
    }
}
