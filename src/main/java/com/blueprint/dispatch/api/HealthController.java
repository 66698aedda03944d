package com.blueprint.dispatch.api;

import com.blueprint.core.health.HealthCheckService;
import com.blueprint.core.health.HealthStatus;
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

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 when no component is DOWN, 503 otherwise.
     * A DEGRADED component makes the overall status DEGRADED.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        HealthStatus.Status overall = HealthStatus.Status.UP;
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                overall = HealthStatus.Status.DOWN;
            } else if (check.status() == HealthStatus.Status.DEGRADED && overall == HealthStatus.Status.UP) {
                overall = HealthStatus.Status.DEGRADED;
            }
        }

        result.put("status", overall.name());
        result.put("components", components);

        return overall == HealthStatus.Status.DOWN
                ? ResponseEntity.status(503).body(result)
                : ResponseEntity.ok(result);
    }
}
