package com.autowake.core.lifecycle;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.config.AutowakeProperties;
import com.autowake.core.health.HealthChecker;
import com.autowake.core.health.HealthState;
import com.autowake.core.logging.MdcContext;
import com.autowake.core.metrics.AutowakeMetrics;
import com.autowake.core.registry.ServiceRegistry;
import com.autowake.core.resolve.DependencyResolver;
import com.autowake.runtime.ContainerRuntimeAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Starts services on demand in dependency order and stops them on request.
 *
 * <p>Within one call, dependency starts are strictly sequential: each dependency must report
 * ready before the next one (or the target) is started, and the first failure aborts the call.
 * A timed-out wait does not undo the start it was waiting for.
 *
 * <p>When auto-lifecycle is disabled the ensure operations succeed without touching any
 * container; services are then assumed to be managed externally.
 */
@Service
public class LifecycleController {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    static final String TRIGGER_ADMIN = "admin";

    private final ContainerRuntimeAdapter runtime;
    private final HealthChecker healthChecker;
    private final DependencyResolver resolver;
    private final ServiceCatalog catalog;
    private final ServiceRegistry registry;
    private final AutowakeMetrics metrics;
    private final boolean enabled;
    private final Duration readyTimeout;
    private final Duration pollInterval;

    public LifecycleController(ContainerRuntimeAdapter runtime,
                               HealthChecker healthChecker,
                               DependencyResolver resolver,
                               ServiceCatalog catalog,
                               ServiceRegistry registry,
                               AutowakeMetrics metrics,
                               AutowakeProperties properties) {
        this.runtime = runtime;
        this.healthChecker = healthChecker;
        this.resolver = resolver;
        this.catalog = catalog;
        this.registry = registry;
        this.metrics = metrics;
        this.enabled = properties.isLifecycleEnabled();
        this.readyTimeout = properties.getReadyTimeout();
        this.pollInterval = properties.getPollInterval();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Makes sure a service and everything it depends on is running and ready.
     *
     * <p>A running service whose dependencies have gone down is restarted together with them.
     * The service and its transitive dependencies all count as used.
     *
     * @return true once the service reported ready; false on the first start failure or wait timeout
     */
    public boolean ensureReady(String serviceName) {
        if (!enabled) {
            return true;
        }
        MdcContext.setService(serviceName);
        try {
            registry.touch(serviceName);
            resolver.resolveDependenciesOf(serviceName).forEach(registry::touch);
            HealthState current = healthChecker.health(serviceName);

            boolean ready;
            if (current.isRunning()) {
                List<String> downDependencies = dependenciesNotRunning(serviceName);
                if (!downDependencies.isEmpty()) {
                    log.warn("Dependencies {} of {} are not running, restarting {} with dependencies",
                            downDependencies, serviceName, serviceName);
                    ready = startWithDependencies(serviceName) && waitUntilReady(serviceName);
                } else if (current == HealthState.UNHEALTHY) {
                    log.info("Service {} is running but not ready yet, waiting", serviceName);
                    ready = waitUntilReady(serviceName);
                } else {
                    ready = true;
                }
            } else {
                log.info("Auto-waking {} (state {}) with dependencies", serviceName, current);
                ready = startWithDependencies(serviceName) && waitUntilReady(serviceName);
            }

            metrics.recordEnsure(serviceName, ready);
            if (!ready) {
                log.warn("Service {} could not be made ready", serviceName);
            }
            return ready;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resolves the dependency closure of all requested services and ensures each in startup order.
     *
     * @return false as soon as one service cannot be made ready
     */
    public boolean ensureMultipleReady(Collection<String> serviceNames) {
        if (!enabled) {
            return true;
        }
        List<String> ordered = resolver.resolve(serviceNames);
        log.info("Resolved service dependencies for {}: {}", serviceNames, ordered);
        for (String service : ordered) {
            if (!ensureReady(service)) {
                log.warn("Stopping multi-service ensure at {}", service);
                return false;
            }
        }
        return true;
    }

    public boolean waitUntilReady(String serviceName) {
        return waitUntilReady(serviceName, readyTimeout);
    }

    /**
     * Polls readiness at the configured interval until it is positive or the timeout elapses.
     * At least one check is made even with a zero timeout.
     */
    public boolean waitUntilReady(String serviceName, Duration timeout) {
        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();
        while (true) {
            if (healthChecker.isReady(serviceName)) {
                metrics.recordReadyWait(serviceName, Duration.ofNanos(System.nanoTime() - startedAt), true);
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to become ready", serviceName);
                return false;
            }
        }
        metrics.recordReadyWait(serviceName, Duration.ofNanos(System.nanoTime() - startedAt), false);
        log.warn("Service {} not ready after {}s", serviceName, timeout.toSeconds());
        return false;
    }

    /** Stops one service. Never cascades to dependents or dependencies. */
    public boolean stop(String serviceName) {
        return stop(serviceName, TRIGGER_ADMIN);
    }

    /**
     * @param trigger who asked for the stop, for metrics ("admin", "idle")
     */
    public boolean stop(String serviceName, String trigger) {
        boolean stopped = runtime.stop(serviceName);
        metrics.recordStop(serviceName, stopped, trigger);
        if (stopped) {
            registry.setActual(serviceName, HealthState.STOPPED);
        } else {
            log.warn("Failed to stop {}", serviceName);
        }
        return stopped;
    }

    /** Starts one service without its dependencies or any readiness wait. */
    public boolean start(String serviceName) {
        return startContainer(serviceName);
    }

    public boolean restart(String serviceName) {
        if (!stop(serviceName)) {
            log.warn("Stop failed during restart of {}, starting anyway", serviceName);
        }
        return start(serviceName);
    }

    private boolean startWithDependencies(String serviceName) {
        for (String dependency : resolver.resolveDependenciesOf(serviceName)) {
            if (!healthChecker.isContainerRunning(dependency)) {
                log.info("Starting dependency {} for {}", dependency, serviceName);
                if (!startContainer(dependency)) {
                    log.warn("Dependency {} of {} failed to start", dependency, serviceName);
                    return false;
                }
            }
            if (!waitUntilReady(dependency)) {
                log.warn("Dependency {} of {} did not become ready", dependency, serviceName);
                return false;
            }
        }
        return startContainer(serviceName);
    }

    private boolean startContainer(String serviceName) {
        boolean started = runtime.start(serviceName);
        metrics.recordStart(serviceName, started);
        if (started) {
            registry.setActual(serviceName, HealthState.RUNNING);
        }
        return started;
    }

    private List<String> dependenciesNotRunning(String serviceName) {
        var down = new ArrayList<String>();
        for (String dependency : catalog.getDependencies(serviceName)) {
            if (!healthChecker.isContainerRunning(dependency)) {
                down.add(dependency);
            }
        }
        return down;
    }
}
