package com.autowake.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "autowake")
public class AutowakeProperties {

    private Lifecycle lifecycle = new Lifecycle();
    private Idle idle = new Idle();
    private Models models = new Models();
    private Probe probe = new Probe();
    private Docker docker = new Docker();
    private Catalog catalog = new Catalog();

    // -- Flat accessors (delegate to nested) --
    public boolean isLifecycleEnabled() { return lifecycle.enabled; }
    public Duration getReadyTimeout() { return lifecycle.readyTimeout; }
    public Duration getPollInterval() { return lifecycle.pollInterval; }
    public boolean isIdleEnabled() { return idle.enabled; }
    public Duration getIdleTimeout() { return idle.timeout; }
    public Duration getIdleCheckInterval() { return idle.checkInterval; }
    public Duration getIdleFailureBackoff() { return idle.failureBackoff; }
    public Duration getModelKeepAlive() { return models.keepAlive; }
    public String getOllamaUrl() { return models.ollamaUrl; }
    public Duration getUnloadTimeout() { return models.unloadTimeout; }
    public Duration getProbeTimeout() { return probe.timeout; }

    public Lifecycle getLifecycle() { return lifecycle; }
    public void setLifecycle(Lifecycle lifecycle) { this.lifecycle = lifecycle; }
    public Idle getIdle() { return idle; }
    public void setIdle(Idle idle) { this.idle = idle; }
    public Models getModels() { return models; }
    public void setModels(Models models) { this.models = models; }
    public Probe getProbe() { return probe; }
    public void setProbe(Probe probe) { this.probe = probe; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public static class Lifecycle {
        /** When false, services are assumed to be managed externally. */
        private boolean enabled = true;
        private Duration readyTimeout = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofSeconds(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getReadyTimeout() { return readyTimeout; }
        public void setReadyTimeout(Duration readyTimeout) { this.readyTimeout = readyTimeout; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class Idle {
        private boolean enabled = true;
        private Duration timeout = Duration.ofMinutes(60);
        private Duration checkInterval = Duration.ofMinutes(5);
        private Duration failureBackoff = Duration.ofSeconds(60);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
        public Duration getFailureBackoff() { return failureBackoff; }
        public void setFailureBackoff(Duration failureBackoff) { this.failureBackoff = failureBackoff; }
    }

    public static class Models {
        private Duration keepAlive = Duration.ofHours(2);
        private String ollamaUrl = "http://ollama:11434";
        private Duration unloadTimeout = Duration.ofSeconds(10);

        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public String getOllamaUrl() { return ollamaUrl; }
        public void setOllamaUrl(String ollamaUrl) { this.ollamaUrl = ollamaUrl; }
        public Duration getUnloadTimeout() { return unloadTimeout; }
        public void setUnloadTimeout(Duration unloadTimeout) { this.unloadTimeout = unloadTimeout; }
    }

    public static class Probe {
        private Duration timeout = Duration.ofSeconds(2);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Docker {
        private String host = "unix:///var/run/docker.sock";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(30);
        private int stopTimeoutSeconds = 10;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getResponseTimeout() { return responseTimeout; }
        public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
    }

    public static class Catalog {
        private boolean failOnCycle = false;
        private List<String> startupOrder = new ArrayList<>();
        private List<String> pinnedOn = new ArrayList<>();
        private Map<String, Service> services = new LinkedHashMap<>();

        public boolean isFailOnCycle() { return failOnCycle; }
        public void setFailOnCycle(boolean failOnCycle) { this.failOnCycle = failOnCycle; }
        public List<String> getStartupOrder() { return startupOrder; }
        public void setStartupOrder(List<String> startupOrder) { this.startupOrder = startupOrder; }
        public List<String> getPinnedOn() { return pinnedOn; }
        public void setPinnedOn(List<String> pinnedOn) { this.pinnedOn = pinnedOn; }
        public Map<String, Service> getServices() { return services; }
        public void setServices(Map<String, Service> services) { this.services = services; }
    }

    public static class Service {
        /** Container name; defaults to the service name when blank. */
        private String container = "";
        private List<String> dependencies = new ArrayList<>();
        private boolean idleEligible = true;
        /** Readiness URL probed with GET; blank means running implies ready. */
        private String probeUrl = "";

        public String getContainer() { return container; }
        public void setContainer(String container) { this.container = container; }
        public List<String> getDependencies() { return dependencies; }
        public void setDependencies(List<String> dependencies) { this.dependencies = dependencies; }
        public boolean isIdleEligible() { return idleEligible; }
        public void setIdleEligible(boolean idleEligible) { this.idleEligible = idleEligible; }
        public String getProbeUrl() { return probeUrl; }
        public void setProbeUrl(String probeUrl) { this.probeUrl = probeUrl; }
    }
}
