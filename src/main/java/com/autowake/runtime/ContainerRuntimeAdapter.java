package com.autowake.runtime;

/**
 * Abstraction over whatever supervises the service containers.
 * Implementations: DockerContainerRuntimeAdapter.
 *
 * <p>Every call must be bounded in time and must report failures through its return value
 * rather than by throwing.
 */
public interface ContainerRuntimeAdapter {

    /**
     * @return {@link ContainerStatus#UNKNOWN} when the runtime could not be asked,
     *         never a guess at RUNNING
     */
    ContainerStatus status(String serviceName);

    /**
     * Starts the service's container. Starting one that is already running counts as success.
     * @return true if the runtime accepted the start
     */
    boolean start(String serviceName);

    /**
     * Stops the service's container. Stopping one that is already stopped counts as success.
     * @return true if the container is stopped afterwards
     */
    boolean stop(String serviceName);
}
