package com.autowake.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for service lifecycle and idle reclamation.
 */
@Service
public class AutowakeMetrics {

    private final MeterRegistry registry;

    public AutowakeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStart(String service, boolean success) {
        Counter.builder("autowake.service.starts")
                .tag("service", service)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordStop(String service, boolean success, String trigger) {
        Counter.builder("autowake.service.stops")
                .description("Container stops by trigger (idle or admin)")
                .tag("service", service)
                .tag("result", success ? "success" : "failure")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a readiness wait took.
     *
     * @param ready false when the wait timed out
     */
    public void recordReadyWait(String service, Duration elapsed, boolean ready) {
        Timer.builder("autowake.service.ready_wait")
                .tag("service", service)
                .tag("ready", String.valueOf(ready))
                .register(registry)
                .record(elapsed);
    }

    public void recordEnsure(String service, boolean ready) {
        Counter.builder("autowake.service.ensure")
                .tag("service", service)
                .tag("ready", String.valueOf(ready))
                .register(registry)
                .increment();
    }

    public void recordModelUnload(String model, boolean success) {
        Counter.builder("autowake.model.unloads")
                .tag("model", model)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordIdleCycle(boolean success) {
        Counter.builder("autowake.idle.cycles")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
