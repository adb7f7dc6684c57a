package com.dvc.dispatch.cli;

import com.dvc.core.health.HealthCheckService;
import com.dvc.core.health.HealthStatus;
import com.dvc.core.health.HealthSummary;
import com.dvc.core.model.SessionStats;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dvc health
 * <p>
 * Checks the challenge catalog, the Docker daemon and the container health
 * monitor of this process. Exits 1 when any of them is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check catalog, Docker and monitor health")
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

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            if (check.metadata().get("health") instanceof HealthSummary summary) {
                System.out.printf("      containers: %d tracked, %d healthy, %d unhealthy, %d starting, %d unknown%n",
                        summary.tracked(), summary.healthy(), summary.unhealthy(), summary.starting(), summary.unknown());
                if (summary.totalRestartAttempts() > 0) {
                    System.out.printf("      restarts:   %d attempt(s)%n", summary.totalRestartAttempts());
                }
            }
            if (check.metadata().get("sessions") instanceof SessionStats stats) {
                System.out.printf("      sessions:   %d active, %d ended, %d user(s)%n",
                        stats.active(), stats.total() - stats.active(), stats.uniqueUsers());
            }
        }

        System.out.println("──────────────────────────────────");
        long down = checks.stream().filter(HealthStatus::isDown).count();
        if (down == 0) {
            ConsoleOutput.success("Engine ready to spawn challenges");
            return 0;
        }
        ConsoleOutput.error(down + " component(s) down; challenges cannot be spawned");
        return 1;
    }
}
