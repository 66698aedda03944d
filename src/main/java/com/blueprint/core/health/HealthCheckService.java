package com.blueprint.core.health;

import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.persistence.BreakdownSessionRepository;
import com.blueprint.core.persistence.ClarificationSessionRepository;
import com.blueprint.core.persistence.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ContentGenerator contentGenerator;
    private final ClarificationSessionRepository clarificationRepository;
    private final BreakdownSessionRepository breakdownRepository;

    public HealthCheckService(
            @Autowired(required = false) ContentGenerator contentGenerator,
            @Autowired(required = false) ClarificationSessionRepository clarificationRepository,
            @Autowired(required = false) BreakdownSessionRepository breakdownRepository) {
        this.contentGenerator = contentGenerator;
        this.clarificationRepository = clarificationRepository;
        this.breakdownRepository = breakdownRepository;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkContentGenerator());
        results.add(checkStore("clarification-store", clarificationRepository));
        results.add(checkStore("breakdown-store", breakdownRepository));
        return results;
    }

    private HealthStatus checkContentGenerator() {
        if (contentGenerator == null) {
            return new HealthStatus("content-generator", HealthStatus.Status.DOWN,
                    "No ContentGenerator configured", Map.of());
        }
        // Without credentials every generation call fails, but stored sessions stay readable.
        if (!contentGenerator.isAvailable()) {
            return new HealthStatus("content-generator", HealthStatus.Status.DEGRADED,
                    "Content generator has no API key configured", Map.of());
        }
        return new HealthStatus("content-generator", HealthStatus.Status.UP,
                "Content generator available (" + contentGenerator.getClass().getSimpleName() + ")",
                Map.of());
    }

    private HealthStatus checkStore(String component, SessionRepository<?> repository) {
        if (repository == null) {
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "No repository configured", Map.of());
        }
        try {
            int sessions = repository.count();
            return new HealthStatus(component, HealthStatus.Status.UP,
                    "Store available", Map.of("sessions", String.valueOf(sessions)));
        } catch (RuntimeException e) {
            log.warn("Health check for {} failed: {}", component, e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
    }
}
