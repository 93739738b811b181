package com.autowake.core.health;

/**
 * Observed condition of a service.
 *
 * <p>{@link #RUNNING} is only ever recorded from a bare container status (e.g. after an
 * admin start); health checks produce the richer states.
 */
public enum HealthState {
    UNKNOWN,
    RUNNING,
    STOPPED,
    DEGRADED,
    HEALTHY,
    UNHEALTHY;

    /** True when the container is known to be up, whatever its readiness. */
    public boolean isRunning() {
        return this == RUNNING || this == DEGRADED || this == HEALTHY || this == UNHEALTHY;
    }
}
