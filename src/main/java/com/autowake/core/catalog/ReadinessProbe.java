package com.autowake.core.catalog;

/**
 * Application-level check that a running service can actually serve requests.
 * Implementations must bound their own duration and report failure as {@code false}.
 */
@FunctionalInterface
public interface ReadinessProbe {

    boolean isReady();
}
