package com.modelgateway.controller;

import com.modelgateway.model.HealthStatus;
import com.modelgateway.model.dto.HealthReport;
import com.modelgateway.service.HealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness, readiness and aggregated health. A DOWN gateway answers 503.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping
    public ResponseEntity<HealthReport> health() {
        return respond(healthService.summary());
    }

    /**
     * The process is up and serving HTTP.
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, String>> live() {
        return ResponseEntity.ok(Map.of("status", HealthStatus.UP.name()));
    }

    /**
     * At least one provider can take traffic.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, String>> ready() {
        if (healthService.isReady()) {
            return ResponseEntity.ok(Map.of("status", HealthStatus.UP.name()));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", HealthStatus.DOWN.name()));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthReport> detailed() {
        return respond(healthService.detailed());
    }

    private static ResponseEntity<HealthReport> respond(HealthReport report) {
        HttpStatus status = report.getStatus() == HealthStatus.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }
}
