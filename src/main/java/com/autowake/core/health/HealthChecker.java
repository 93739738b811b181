package com.autowake.core.health;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import com.autowake.core.registry.ServiceRegistry;
import com.autowake.runtime.ContainerRuntimeAdapter;
import com.autowake.runtime.ContainerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Classifies a service's health by combining container status, dependency container status
 * and the service's readiness probe. Nothing is cached: each call asks the runtime again and
 * records the result in the {@link ServiceRegistry}.
 *
 * <p>Evaluation order, first match wins:
 * <ol>
 *   <li>container not running: STOPPED (dependencies are not checked)</li>
 *   <li>a dependency's container not running: DEGRADED</li>
 *   <li>probe fails or times out: UNHEALTHY, otherwise HEALTHY</li>
 * </ol>
 * Whenever the runtime cannot answer, the result is UNKNOWN, which callers must never read as ready.
 */
@Service
public class HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final ContainerRuntimeAdapter runtime;
    private final ServiceCatalog catalog;
    private final ServiceRegistry registry;

    public HealthChecker(ContainerRuntimeAdapter runtime, ServiceCatalog catalog, ServiceRegistry registry) {
        this.runtime = runtime;
        this.catalog = catalog;
        this.registry = registry;
    }

    public HealthState health(String serviceName) {
        HealthState state;
        try {
            state = evaluate(serviceName);
        } catch (RuntimeException e) {
            log.warn("Health check for {} failed: {}", serviceName, e.getMessage());
            state = HealthState.UNKNOWN;
        }
        registry.setActual(serviceName, state);
        return state;
    }

    /**
     * Positive readiness signal used while waiting for a start to take effect. Services without a
     * probe only need a running container, so the dependency and probe steps are skipped.
     */
    public boolean isReady(String serviceName) {
        Optional<ServiceDescriptor> descriptor = catalog.find(serviceName);
        if (descriptor.isPresent() && descriptor.get().hasReadinessProbe()) {
            return health(serviceName) == HealthState.HEALTHY;
        }
        return isContainerRunning(serviceName);
    }

    /** Direct container liveness only, no dependency or probe evaluation. */
    public boolean isContainerRunning(String serviceName) {
        try {
            return runtime.status(serviceName) == ContainerStatus.RUNNING;
        } catch (RuntimeException e) {
            log.warn("Status check for {} failed: {}", serviceName, e.getMessage());
            return false;
        }
    }

    private HealthState evaluate(String serviceName) {
        ContainerStatus status = runtime.status(serviceName);
        if (status == ContainerStatus.STOPPED) {
            return HealthState.STOPPED;
        }
        if (status != ContainerStatus.RUNNING) {
            return HealthState.UNKNOWN;
        }

        boolean unknownDependency = false;
        for (String dep : catalog.getDependencies(serviceName)) {
            ContainerStatus depStatus = runtime.status(dep);
            if (depStatus == ContainerStatus.STOPPED) {
                log.debug("Service {} degraded: dependency {} is not running", serviceName, dep);
                return HealthState.DEGRADED;
            }
            if (depStatus != ContainerStatus.RUNNING) {
                unknownDependency = true;
            }
        }
        if (unknownDependency) {
            return HealthState.UNKNOWN;
        }

        Optional<ServiceDescriptor> descriptor = catalog.find(serviceName);
        if (descriptor.isEmpty() || !descriptor.get().hasReadinessProbe()) {
            return HealthState.HEALTHY;
        }
        try {
            return descriptor.get().readinessProbe().isReady() ? HealthState.HEALTHY : HealthState.UNHEALTHY;
        } catch (RuntimeException e) {
            log.debug("Readiness probe for {} threw: {}", serviceName, e.getMessage());
            return HealthState.UNHEALTHY;
        }
    }
}
