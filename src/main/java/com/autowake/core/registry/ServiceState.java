package com.autowake.core.registry;

import com.autowake.core.health.HealthState;

import java.time.Instant;

/**
 * Point-in-time view of one service's bookkeeping.
 *
 * @param desired  administrative intent
 * @param actual   last health observed; advisory only, the container runtime is authoritative
 * @param lastUsed last time a caller needed the service, {@code null} if never
 */
public record ServiceState(
    DesiredState desired,
    HealthState actual,
    Instant lastUsed
) {
    public static ServiceState initial(DesiredState desired) {
        return new ServiceState(desired, HealthState.UNKNOWN, null);
    }

    public boolean hasBeenUsed() {
        return lastUsed != null;
    }

    ServiceState withActual(HealthState actual) {
        return new ServiceState(desired, actual, lastUsed);
    }

    ServiceState withDesired(DesiredState desired) {
        return new ServiceState(desired, actual, lastUsed);
    }

    ServiceState withLastUsed(Instant lastUsed) {
        return new ServiceState(desired, actual, lastUsed);
    }
}
