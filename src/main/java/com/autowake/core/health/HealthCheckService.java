package com.autowake.core.health;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Fleet-wide health summary for status display. Runs a fresh {@link HealthChecker#health}
 * for every catalog service.
 */
@Service
public class HealthCheckService {

    private final HealthChecker healthChecker;
    private final ServiceCatalog catalog;

    public HealthCheckService(HealthChecker healthChecker, ServiceCatalog catalog) {
        this.healthChecker = healthChecker;
        this.catalog = catalog;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        for (ServiceDescriptor descriptor : catalog.descriptors()) {
            results.add(check(descriptor));
        }
        return results;
    }

    private HealthStatus check(ServiceDescriptor descriptor) {
        HealthState state = healthChecker.health(descriptor.name());
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("state", state.name());
        metadata.put("container", descriptor.containerName());
        metadata.put("idleEligible", String.valueOf(descriptor.idleEligible()));
        if (!descriptor.dependencies().isEmpty()) {
            metadata.put("dependencies", String.join(",", descriptor.dependencies()));
        }

        return switch (state) {
            case HEALTHY, RUNNING -> new HealthStatus(descriptor.name(), HealthStatus.Status.UP,
                    "Running and ready", metadata);
            case DEGRADED -> new HealthStatus(descriptor.name(), HealthStatus.Status.DEGRADED,
                    "Running, but a dependency is down", metadata);
            case UNHEALTHY -> new HealthStatus(descriptor.name(), HealthStatus.Status.DEGRADED,
                    "Running, readiness probe failing", metadata);
            case STOPPED -> new HealthStatus(descriptor.name(), HealthStatus.Status.DOWN,
                    descriptor.idleEligible() ? "Stopped (starts on demand)" : "Stopped", metadata);
            case UNKNOWN -> new HealthStatus(descriptor.name(), HealthStatus.Status.DOWN,
                    "Status unknown: container runtime did not answer", metadata);
        };
    }
}
