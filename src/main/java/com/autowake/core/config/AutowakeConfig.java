package com.autowake.core.config;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import com.autowake.core.health.HttpReadinessProbe;
import com.autowake.core.idle.ModelLeaseTable;
import com.autowake.core.idle.ModelUnloader;
import com.autowake.inference.OllamaModelUnloader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Configuration
public class AutowakeConfig {

    private static final Logger log = LoggerFactory.getLogger(AutowakeConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient autowakeHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Bean
    public ServiceCatalog serviceCatalog(AutowakeProperties properties, HttpClient autowakeHttpClient) {
        ServiceCatalog catalog = buildCatalog(properties, autowakeHttpClient);

        Optional<List<String>> cycle = catalog.findCycle();
        if (cycle.isPresent()) {
            String path = String.join(" -> ", cycle.get());
            if (properties.getCatalog().isFailOnCycle()) {
                throw new IllegalStateException("Service dependency cycle: " + path);
            }
            log.warn("Service dependency cycle {} tolerated; startup order among these services is arbitrary", path);
        }
        var undeclared = catalog.undeclaredDependencies();
        if (!undeclared.isEmpty()) {
            log.warn("Dependencies {} are not declared services and will be treated as unmanaged leaves", undeclared);
        }
        log.info("Service catalog loaded: {} (startup order {})", catalog.serviceNames(), catalog.startupOrder());
        return catalog;
    }

    /**
     * Builds the catalog from the {@code autowake.catalog} properties. A non-blank probe URL
     * becomes an {@link HttpReadinessProbe} bounded by {@code autowake.probe.timeout}.
     */
    static ServiceCatalog buildCatalog(AutowakeProperties properties, HttpClient httpClient) {
        var catalogProps = properties.getCatalog();
        var descriptors = new ArrayList<ServiceDescriptor>();
        catalogProps.getServices().forEach((name, service) -> {
            HttpReadinessProbe probe = service.getProbeUrl() == null || service.getProbeUrl().isBlank()
                    ? null
                    : new HttpReadinessProbe(httpClient, service.getProbeUrl(), properties.getProbeTimeout());
            descriptors.add(new ServiceDescriptor(
                    name,
                    service.getContainer(),
                    new LinkedHashSet<>(service.getDependencies()),
                    service.isIdleEligible(),
                    probe));
        });
        return new ServiceCatalog(descriptors, catalogProps.getStartupOrder(), catalogProps.getPinnedOn());
    }

    @Bean
    public ModelLeaseTable modelLeaseTable(Clock clock, AutowakeProperties properties) {
        return new ModelLeaseTable(clock, properties.getModelKeepAlive());
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelUnloader modelUnloader(HttpClient autowakeHttpClient, ObjectMapper objectMapper,
                                       AutowakeProperties properties) {
        return new OllamaModelUnloader(autowakeHttpClient, objectMapper,
                properties.getOllamaUrl(), properties.getUnloadTimeout());
    }
}
