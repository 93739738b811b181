package com.autowake.dispatch.cli;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import com.autowake.core.health.HealthChecker;
import com.autowake.core.health.HealthState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: autowake status
 * <p>
 * Lists every catalog service with its container, dependencies and current state.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show service states and dependencies")
@Component
public class StatusCommand implements Runnable {

    private final ServiceCatalog catalog;
    private final HealthChecker healthChecker;

    public StatusCommand(ServiceCatalog catalog, HealthChecker healthChecker) {
        this.catalog = catalog;
        this.healthChecker = healthChecker;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Startup order: " + String.join(" -> ", catalog.startupOrder()));
        for (ServiceDescriptor descriptor : catalog.descriptors()) {
            HealthState state = healthChecker.health(descriptor.name());
            var extra = new StringBuilder("(" + descriptor.containerName() + ")");
            if (!descriptor.dependencies().isEmpty()) {
                extra.append(" needs ").append(String.join(", ", descriptor.dependencies()));
            }
            if (!descriptor.idleEligible()) {
                extra.append(" [always on]");
            }
            ConsoleOutput.serviceState(descriptor.name(), state, extra.toString());
        }
    }
}
