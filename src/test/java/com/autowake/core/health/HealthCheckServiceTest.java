package com.autowake.core.health;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private HealthChecker healthChecker;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        healthChecker = mock(HealthChecker.class);
        var catalog = new ServiceCatalog(List.of(
                new ServiceDescriptor("redis", "abs-redis", Set.of(), false, null),
                new ServiceDescriptor("onyx", "abs-onyx", Set.of("redis"), true, null),
                ServiceDescriptor.leaf("ollama")
        ), List.of(), List.of());
        service = new HealthCheckService(healthChecker, catalog);
    }

    @Test
    void reportsEveryCatalogServiceInOrder() {
        when(healthChecker.health("redis")).thenReturn(HealthState.HEALTHY);
        when(healthChecker.health("onyx")).thenReturn(HealthState.DEGRADED);
        when(healthChecker.health("ollama")).thenReturn(HealthState.STOPPED);

        List<HealthStatus> results = service.checkAll();

        assertEquals(3, results.size());
        assertEquals("redis", results.get(0).component());
        assertEquals(HealthStatus.Status.UP, results.get(0).status());
        assertEquals(HealthStatus.Status.DEGRADED, results.get(1).status());
        assertEquals(HealthStatus.Status.DOWN, results.get(2).status());
        assertTrue(results.get(2).detail().contains("on demand"));
    }

    @Test
    void unknownIsReportedDown() {
        when(healthChecker.health("redis")).thenReturn(HealthState.UNKNOWN);
        when(healthChecker.health("onyx")).thenReturn(HealthState.UNHEALTHY);
        when(healthChecker.health("ollama")).thenReturn(HealthState.HEALTHY);

        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DOWN, results.get(0).status());
        assertEquals(HealthStatus.Status.DEGRADED, results.get(1).status());
    }

    @Test
    void metadataDescribesTheService() {
        when(healthChecker.health("redis")).thenReturn(HealthState.HEALTHY);
        when(healthChecker.health("onyx")).thenReturn(HealthState.HEALTHY);
        when(healthChecker.health("ollama")).thenReturn(HealthState.HEALTHY);

        var onyx = service.checkAll().get(1);

        assertEquals("abs-onyx", onyx.metadata().get("container"));
        assertEquals("redis", onyx.metadata().get("dependencies"));
        assertEquals("true", onyx.metadata().get("idleEligible"));
        assertEquals("HEALTHY", onyx.metadata().get("state"));
    }

    @Test
    void onlyAlwaysOnServicesCountAsOutages() {
        when(healthChecker.health("redis")).thenReturn(HealthState.STOPPED);
        when(healthChecker.health("onyx")).thenReturn(HealthState.DEGRADED);
        when(healthChecker.health("ollama")).thenReturn(HealthState.STOPPED);

        List<HealthStatus> results = service.checkAll();

        assertTrue(results.get(0).isOutage());
        assertFalse(results.get(1).isOutage());
        assertFalse(results.get(2).isOutage());
        assertTrue(results.get(2).idleEligible());
        assertFalse(new HealthStatus("x", HealthStatus.Status.DOWN, "down", null).idleEligible());
    }
}
