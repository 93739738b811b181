package com.autowake.runtime;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Docker-based ContainerRuntimeAdapter.
 * Drives the pre-created containers named in the service catalog (e.g. "abs-ollama").
 *
 * <p>Containers are never created or removed here, only started and stopped. Timeouts are
 * bounded by the Docker HTTP client configuration and the stop grace period.
 */
public class DockerContainerRuntimeAdapter implements ContainerRuntimeAdapter {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntimeAdapter.class);

    private final DockerClient dockerClient;
    private final ServiceCatalog catalog;
    private final int stopTimeoutSeconds;

    public DockerContainerRuntimeAdapter(DockerClient dockerClient, ServiceCatalog catalog, int stopTimeoutSeconds) {
        this.dockerClient = dockerClient;
        this.catalog = catalog;
        this.stopTimeoutSeconds = stopTimeoutSeconds;
    }

    @Override
    public ContainerStatus status(String serviceName) {
        Optional<String> container = containerFor(serviceName);
        if (container.isEmpty()) {
            return ContainerStatus.UNKNOWN;
        }
        try {
            var state = dockerClient.inspectContainerCmd(container.get()).exec().getState();
            return state != null && Boolean.TRUE.equals(state.getRunning())
                    ? ContainerStatus.RUNNING
                    : ContainerStatus.STOPPED;
        } catch (NotFoundException e) {
            log.debug("Container {} for service {} does not exist", container.get(), serviceName);
            return ContainerStatus.STOPPED;
        } catch (Exception e) {
            log.warn("Failed to inspect container {} for service {}: {}",
                    container.get(), serviceName, e.getMessage());
            return ContainerStatus.UNKNOWN;
        }
    }

    @Override
    public boolean start(String serviceName) {
        Optional<String> container = containerFor(serviceName);
        if (container.isEmpty()) {
            log.warn("No container mapped for service {}, cannot start", serviceName);
            return false;
        }
        try {
            dockerClient.startContainerCmd(container.get()).exec();
            log.info("Started container {} for service {}", container.get(), serviceName);
            return true;
        } catch (NotModifiedException e) {
            log.debug("Container {} already running", container.get());
            return true;
        } catch (Exception e) {
            log.error("Failed to start container {} for service {}: {}",
                    container.get(), serviceName, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean stop(String serviceName) {
        Optional<String> container = containerFor(serviceName);
        if (container.isEmpty()) {
            log.warn("No container mapped for service {}, cannot stop", serviceName);
            return false;
        }
        try {
            dockerClient.stopContainerCmd(container.get()).withTimeout(stopTimeoutSeconds).exec();
            log.info("Stopped container {} for service {}", container.get(), serviceName);
            return true;
        } catch (NotModifiedException e) {
            log.debug("Container {} already stopped", container.get());
            return true;
        } catch (Exception e) {
            log.error("Failed to stop container {} for service {}: {}",
                    container.get(), serviceName, e.getMessage());
            return false;
        }
    }

    private Optional<String> containerFor(String serviceName) {
        return catalog.find(serviceName).map(ServiceDescriptor::containerName);
    }
}
