package com.autowake.core.idle;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.config.AutowakeProperties;
import com.autowake.core.lifecycle.LifecycleController;
import com.autowake.core.logging.MdcContext;
import com.autowake.core.metrics.AutowakeMetrics;
import com.autowake.core.registry.DesiredState;
import com.autowake.core.registry.ServiceRegistry;
import com.autowake.core.registry.ServiceState;
import com.autowake.runtime.ContainerRuntimeAdapter;
import com.autowake.runtime.ContainerStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop that reclaims idle resources.
 *
 * <p>Each cycle stops idle-eligible, unpinned services that have not been used for longer than
 * the idle timeout, then unloads inference models whose keep-alive lease has expired. Cycles run
 * on a single thread and reschedule themselves with a fixed delay, so they never overlap. A failed
 * cycle is logged and the next one runs after the failure backoff instead of the normal interval.
 */
@Service
public class IdleMonitor {

    private static final Logger log = LoggerFactory.getLogger(IdleMonitor.class);

    static final String TRIGGER_IDLE = "idle";

    private final ServiceCatalog catalog;
    private final ServiceRegistry registry;
    private final ContainerRuntimeAdapter runtime;
    private final LifecycleController lifecycle;
    private final ModelLeaseTable leases;
    private final ModelUnloader unloader;
    private final AutowakeMetrics metrics;
    private final Clock clock;

    private final boolean enabled;
    private final Duration idleTimeout;
    private final Duration checkInterval;
    private final Duration failureBackoff;

    private final AtomicBoolean cycleRunning = new AtomicBoolean();
    private final AtomicLong cycles = new AtomicLong();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "idle-monitor");
        t.setDaemon(true);
        return t;
    });

    public IdleMonitor(ServiceCatalog catalog,
                       ServiceRegistry registry,
                       ContainerRuntimeAdapter runtime,
                       LifecycleController lifecycle,
                       ModelLeaseTable leases,
                       ModelUnloader unloader,
                       AutowakeMetrics metrics,
                       Clock clock,
                       AutowakeProperties properties) {
        this.catalog = catalog;
        this.registry = registry;
        this.runtime = runtime;
        this.lifecycle = lifecycle;
        this.leases = leases;
        this.unloader = unloader;
        this.metrics = metrics;
        this.clock = clock;
        this.enabled = properties.isIdleEnabled();
        this.idleTimeout = properties.getIdleTimeout();
        this.checkInterval = properties.getIdleCheckInterval();
        this.failureBackoff = properties.getIdleFailureBackoff();
    }

    /**
     * Outcome of one cycle.
     *
     * @param skipped true when another cycle was still running
     */
    public record CycleReport(List<String> stoppedServices, List<String> unloadedModels, boolean skipped) {
        static CycleReport skippedCycle() {
            return new CycleReport(List.of(), List.of(), true);
        }
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Idle monitor disabled");
            return;
        }
        scheduleNext(checkInterval);
        log.info("Idle monitor started (interval={}s, idle timeout={}m)",
                checkInterval.toSeconds(), idleTimeout.toMinutes());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Idle monitor stopped");
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Runs one cycle on the calling thread. Skipped, not queued, if a cycle is already running.
     * Exceptions from the container runtime or the inference runtime propagate to the caller.
     */
    public CycleReport runCycle() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Previous idle cycle still running, skipping");
            return CycleReport.skippedCycle();
        }
        try {
            MdcContext.setIdleCycle(cycles.incrementAndGet());
            Instant now = clock.instant();
            List<String> stopped = stopIdleServices(now);
            List<String> unloaded = unloadExpiredModels(now);
            metrics.recordIdleCycle(true);
            return new CycleReport(stopped, unloaded, false);
        } finally {
            cycleRunning.set(false);
            MdcContext.clear();
        }
    }

    private void tick() {
        Duration next = checkInterval;
        try {
            runCycle();
        } catch (Exception e) {
            metrics.recordIdleCycle(false);
            next = failureBackoff;
            log.error("Idle monitor cycle failed, retrying in {}s", failureBackoff.toSeconds(), e);
        } finally {
            scheduleNext(next);
        }
    }

    private void scheduleNext(Duration delay) {
        if (scheduler.isShutdown()) {
            return;
        }
        try {
            scheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Idle monitor shutting down, next cycle not scheduled");
        }
    }

    private List<String> stopIdleServices(Instant now) {
        if (!lifecycle.isEnabled()) {
            return List.of();
        }
        var stopped = new ArrayList<String>();
        for (String service : catalog.serviceNames()) {
            if (!catalog.isIdleEligible(service)) continue;

            ServiceState state = registry.get(service);
            if (state.desired() == DesiredState.ON || !isIdle(state, now)) continue;

            Optional<String> activeDependent = activeDependent(service, now);
            if (activeDependent.isPresent()) {
                log.debug("Service {} idle but still needed by {}", service, activeDependent.get());
                continue;
            }

            if (runtime.status(service) != ContainerStatus.RUNNING) continue;

            // a caller may have touched the service while its status was fetched
            state = registry.get(service);
            if (!isIdle(state, clock.instant())) continue;

            Duration idle = Duration.between(state.lastUsed(), now);
            MdcContext.setService(service);
            log.info("Service {} idle for {}m, stopping", service, idle.toMinutes());
            if (lifecycle.stop(service, TRIGGER_IDLE)) {
                stopped.add(service);
            }
        }
        return stopped;
    }

    private boolean isIdle(ServiceState state, Instant now) {
        return state.hasBeenUsed() && Duration.between(state.lastUsed(), now).compareTo(idleTimeout) > 0;
    }

    /** A catalog service depending on {@code service} that has been used within the idle timeout. */
    private Optional<String> activeDependent(String service, Instant now) {
        for (String candidate : catalog.serviceNames()) {
            if (candidate.equals(service) || !catalog.getDependencies(candidate).contains(service)) continue;
            ServiceState dependent = registry.get(candidate);
            if (dependent.hasBeenUsed() && !isIdle(dependent, now)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<String> unloadExpiredModels(Instant now) {
        var unloaded = new ArrayList<String>();
        for (ModelLease lease : leases.expired(now)) {
            MdcContext.setModel(lease.modelName());
            log.info("Model {} keep-alive expired at {}, unloading", lease.modelName(), lease.keepAliveUntil());
            boolean success = unloader.unload(lease.modelName());
            metrics.recordModelUnload(lease.modelName(), success);
            if (success) {
                leases.clear(lease);
                unloaded.add(lease.modelName());
                log.info("Unloaded idle model {}", lease.modelName());
            } else {
                log.warn("Could not unload model {}, will retry next cycle", lease.modelName());
            }
        }
        return unloaded;
    }
}
