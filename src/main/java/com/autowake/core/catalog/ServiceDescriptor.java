package com.autowake.core.catalog;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a managed service, loaded once at startup.
 *
 * @param name           logical service name (e.g. "ollama")
 * @param containerName  container backing the service
 * @param dependencies   services that must be ready before this one starts
 * @param idleEligible   whether the idle monitor may stop this service
 * @param readinessProbe probe confirming readiness, or {@code null} when a running container is enough
 */
public record ServiceDescriptor(
    String name,
    String containerName,
    Set<String> dependencies,
    boolean idleEligible,
    ReadinessProbe readinessProbe
) {
    public ServiceDescriptor {
        Objects.requireNonNull(name, "name");
        containerName = containerName == null || containerName.isBlank() ? name : containerName;
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public static ServiceDescriptor leaf(String name) {
        return new ServiceDescriptor(name, name, Set.of(), true, null);
    }

    public boolean hasReadinessProbe() {
        return readinessProbe != null;
    }
}
