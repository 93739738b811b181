package com.autowake.core.registry;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.health.HealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-wide mutable state for every known service.
 *
 * <p>Entries are immutable {@link ServiceState} records replaced atomically, so concurrent
 * readers never observe a half-written state. Entries are never removed; names missing from
 * the catalog get an entry on first write.
 */
@Service
public class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final ConcurrentHashMap<String, ServiceState> states = new ConcurrentHashMap<>();
    private final ServiceCatalog catalog;
    private final Clock clock;

    public ServiceRegistry(ServiceCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
        for (String name : catalog.serviceNames()) {
            states.put(name, ServiceState.initial(defaultDesired(name)));
        }
        for (String name : catalog.pinnedOn()) {
            states.putIfAbsent(name, ServiceState.initial(DesiredState.ON));
        }
    }

    public ServiceState get(String name) {
        ServiceState state = states.get(name);
        return state != null ? state : ServiceState.initial(defaultDesired(name));
    }

    /** Records that a caller needed the service just now. */
    public void touch(String name) {
        var now = clock.instant();
        update(name, s -> s.withLastUsed(now));
    }

    public void setActual(String name, HealthState actual) {
        Objects.requireNonNull(actual, "actual");
        ServiceState previous = states.get(name);
        update(name, s -> s.withActual(actual));
        if (previous == null || previous.actual() != actual) {
            log.debug("Service {} actual state -> {}", name, actual);
        }
    }

    public void setDesired(String name, DesiredState desired) {
        Objects.requireNonNull(desired, "desired");
        update(name, s -> s.withDesired(desired));
        log.info("Service {} desired state set to {}", name, desired);
    }

    /** Read-only copy: catalog services first in declaration order, then any others. */
    public Map<String, ServiceState> snapshot() {
        var result = new LinkedHashMap<String, ServiceState>();
        for (String name : catalog.serviceNames()) {
            result.put(name, get(name));
        }
        states.forEach(result::putIfAbsent);
        return Collections.unmodifiableMap(result);
    }

    private void update(String name, UnaryOperator<ServiceState> change) {
        states.compute(name, (k, current) ->
                change.apply(current != null ? current : ServiceState.initial(defaultDesired(k))));
    }

    private DesiredState defaultDesired(String name) {
        return catalog.isPinnedOn(name) ? DesiredState.ON : DesiredState.OFF;
    }
}
