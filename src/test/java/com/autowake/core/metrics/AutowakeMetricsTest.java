package com.autowake.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AutowakeMetricsTest {

    private SimpleMeterRegistry registry;
    private AutowakeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AutowakeMetrics(registry);
    }

    @Test
    @DisplayName("recordStop tags by trigger")
    void recordStopByTrigger() {
        metrics.recordStop("ollama", true, "idle");
        metrics.recordStop("ollama", true, "idle");
        metrics.recordStop("ollama", false, "admin");

        var idle = registry.find("autowake.service.stops").tag("trigger", "idle").counter();
        var admin = registry.find("autowake.service.stops").tag("trigger", "admin").tag("result", "failure").counter();
        assertNotNull(idle);
        assertEquals(2.0, idle.count());
        assertEquals(1.0, admin.count());
    }

    @Test
    @DisplayName("recordReadyWait creates a timer per outcome")
    void recordReadyWait() {
        metrics.recordReadyWait("qdrant", Duration.ofSeconds(3), true);

        var timer = registry.find("autowake.service.ready_wait").tag("ready", "true").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNull(registry.find("autowake.service.ready_wait").tag("ready", "false").timer());
    }

    @Test
    void recordModelUnload() {
        metrics.recordModelUnload("llama3", false);
        assertEquals(1.0, registry.find("autowake.model.unloads")
                .tag("model", "llama3").tag("result", "failure").counter().count());
    }
}
