package com.autowake.core.config;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.health.HttpReadinessProbe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AutowakeConfigTest {

    private final HttpClient httpClient = HttpClient.newHttpClient();
    private AutowakeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AutowakeProperties();
        properties.getCatalog().setStartupOrder(List.of("redis", "ollama", "onyx"));
        properties.getCatalog().getServices().put("redis", service("abs-redis", false, ""));
        properties.getCatalog().getServices().put("ollama", service("", true, "http://ollama:11434/api/tags"));
        properties.getCatalog().getServices().put("onyx", service("abs-onyx", true, "", "redis"));
    }

    private static AutowakeProperties.Service service(String container, boolean idleEligible, String probeUrl,
                                                      String... deps) {
        var service = new AutowakeProperties.Service();
        service.setContainer(container);
        service.setIdleEligible(idleEligible);
        service.setProbeUrl(probeUrl);
        service.setDependencies(List.of(deps));
        return service;
    }

    @Test
    void buildsCatalogFromProperties() {
        ServiceCatalog catalog = AutowakeConfig.buildCatalog(properties, httpClient);

        assertEquals(List.of("redis", "ollama", "onyx"), catalog.serviceNames());
        assertEquals("abs-redis", catalog.find("redis").orElseThrow().containerName());
        assertEquals("ollama", catalog.find("ollama").orElseThrow().containerName());
        assertFalse(catalog.isIdleEligible("redis"));
        assertEquals(Set.of("redis"), catalog.getDependencies("onyx"));
    }

    @Test
    void probeUrlBecomesHttpProbe() {
        ServiceCatalog catalog = AutowakeConfig.buildCatalog(properties, httpClient);

        var probe = catalog.find("ollama").orElseThrow().readinessProbe();
        assertInstanceOf(HttpReadinessProbe.class, probe);
        assertEquals(URI.create("http://ollama:11434/api/tags"), ((HttpReadinessProbe) probe).getUri());
        assertFalse(catalog.find("redis").orElseThrow().hasReadinessProbe());
    }

    @Test
    void cycleIsToleratedByDefault() {
        properties.getCatalog().getServices().put("redis", service("abs-redis", false, "", "onyx"));

        ServiceCatalog catalog = new AutowakeConfig().serviceCatalog(properties, httpClient);

        assertTrue(catalog.findCycle().isPresent());
    }

    @Test
    void cycleFailsStartupWhenConfigured() {
        properties.getCatalog().setFailOnCycle(true);
        properties.getCatalog().getServices().put("redis", service("abs-redis", false, "", "onyx"));

        var error = assertThrows(IllegalStateException.class,
                () -> new AutowakeConfig().serviceCatalog(properties, httpClient));
        assertTrue(error.getMessage().contains("redis"));
        assertTrue(error.getMessage().contains("onyx"));
    }
}
