package com.playfactory.dispatch.api;

import com.playfactory.core.health.HealthCheckService;
import com.playfactory.core.health.HealthStatus;
import com.playfactory.matchmaker.LivenessRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final LivenessRegistry livenessRegistry;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService,
                            @Autowired(required = false) LivenessRegistry livenessRegistry) {
        this.healthCheckService = healthCheckService;
        this.livenessRegistry = livenessRegistry;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503. DEGRADED components
     * do not fail the check.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        boolean anyDown = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);
        if (livenessRegistry != null) {
            result.put("matchmaker", livenessRegistry.statistics());
        }

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
