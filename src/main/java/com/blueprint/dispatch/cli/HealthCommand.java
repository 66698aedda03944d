package com.blueprint.dispatch.cli;

import com.blueprint.core.health.HealthStatus;
import com.blueprint.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: blueprint health
 * <p>
 * Prints one line per component, with its metadata when {@code --details} is set.
 * Exits with 1 when any component is DOWN; DEGRADED components only warn.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check the generator and the session stores")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--details", "-d"}, description = "Show component metadata")
    private boolean details;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        Map<HealthStatus.Status, Integer> counts = new EnumMap<>(HealthStatus.Status.class);
        for (HealthStatus check : checks) {
            counts.merge(check.status(), 1, Integer::sum);
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            if (details) {
                new TreeMap<>(check.metadata()).forEach((key, value) ->
                        System.out.println("      " + key + " = " + value));
            }
        }

        int up = counts.getOrDefault(HealthStatus.Status.UP, 0);
        int degraded = counts.getOrDefault(HealthStatus.Status.DEGRADED, 0);
        int down = counts.getOrDefault(HealthStatus.Status.DOWN, 0);
        String summary = String.format("Overall: %d up, %d degraded, %d down", up, degraded, down);

        System.out.println(ConsoleOutput.RULE);
        if (down > 0) {
            ConsoleOutput.error(summary);
            return 1;
        }
        if (degraded > 0) {
            ConsoleOutput.warn(summary);
        } else {
            ConsoleOutput.success(summary);
        }
        return 0;
    }
}
