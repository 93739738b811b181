package com.autowake.dispatch.cli;

import com.autowake.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: autowake health
 * <p>
 * Runs a fresh health check for every catalog service and prints the result.
 * Exit code 1 when any service that must always run is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check health of all services")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean pinnedDown = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    pinnedDown |= check.isOutage();
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (pinnedDown) {
            ConsoleOutput.error("Overall: an always-on service is down");
            return 1;
        }
        ConsoleOutput.success("Overall: always-on services operational");
        return 0;
    }
}
