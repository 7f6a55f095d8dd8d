package com.congruence.dispatch.cli;

import com.congruence.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: congruence health
 * <p>
 * Checks the database, the git binary and the miner backend.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

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

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (healthCheckService.isHealthy(checks)) {
            ConsoleOutput.success("Overall: operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components down");
        return 1;
    }
}
