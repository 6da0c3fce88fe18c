package com.smarttest.dispatch.cli;

import com.smarttest.core.health.HealthCheckService;
import com.smarttest.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CLI command: smarttest health
 * <p>
 * Reports the run repository, the database and the workspace root. In-memory storage shows
 * up as degraded rather than down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String line = check.component() + ": " + check.detail() + describe(check);
            switch (check.status()) {
                case UP -> ConsoleOutput.success(line);
                case DEGRADED -> ConsoleOutput.info(line);
                case DOWN -> ConsoleOutput.error(line);
            }
        }

        System.out.println();
        switch (HealthStatus.overall(checks)) {
            case DOWN -> ConsoleOutput.error("Overall: "
                    + HealthStatus.count(checks, HealthStatus.Status.DOWN) + " component(s) down");
            case DEGRADED -> ConsoleOutput.info("Overall: usable, "
                    + HealthStatus.count(checks, HealthStatus.Status.DEGRADED) + " component(s) degraded");
            case UP -> ConsoleOutput.success("Overall: all components up");
        }
    }

    private static String describe(HealthStatus check) {
        if (check.metadata().isEmpty()) {
            return "";
        }
        return check.metadata().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " [", "]"));
    }
}
