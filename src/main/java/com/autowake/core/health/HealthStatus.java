package com.autowake.core.health;

import java.util.Map;

/**
 * Health line for one catalog service, as shown by the {@code health} command and the
 * fleet health endpoint.
 *
 * @param component service name
 * @param metadata  string facts about the service: state, container, idleEligible, dependencies
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    /** Whether the service may be asleep; absent metadata means it must always run. */
    public boolean idleEligible() {
        return metadata != null && Boolean.parseBoolean(metadata.get("idleEligible"));
    }

    /** DOWN for a service that is expected to always run. */
    public boolean isOutage() {
        return status == Status.DOWN && !idleEligible();
    }
}
