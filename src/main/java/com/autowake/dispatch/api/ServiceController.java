package com.autowake.dispatch.api;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.config.AutowakeProperties;
import com.autowake.core.health.HealthChecker;
import com.autowake.core.health.HealthState;
import com.autowake.core.idle.ModelLeaseTable;
import com.autowake.core.lifecycle.LifecycleController;
import com.autowake.core.registry.DesiredState;
import com.autowake.core.registry.ServiceRegistry;
import com.autowake.core.registry.ServiceState;
import com.autowake.core.resolve.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for service lifecycle status and admin actions.
 */
@RestController
@RequestMapping("/api/v1/services")
public class ServiceController {

    private static final Logger log = LoggerFactory.getLogger(ServiceController.class);

    private final LifecycleController lifecycle;
    private final HealthChecker healthChecker;
    private final ServiceRegistry registry;
    private final ServiceCatalog catalog;
    private final DependencyResolver resolver;
    private final ModelLeaseTable leases;
    private final AutowakeProperties properties;

    public ServiceController(LifecycleController lifecycle, HealthChecker healthChecker,
                             ServiceRegistry registry, ServiceCatalog catalog,
                             DependencyResolver resolver, ModelLeaseTable leases,
                             AutowakeProperties properties) {
        this.lifecycle = lifecycle;
        this.healthChecker = healthChecker;
        this.registry = registry;
        this.catalog = catalog;
        this.resolver = resolver;
        this.leases = leases;
        this.properties = properties;
    }

    /**
     * GET /api/v1/services: Registry snapshot with settings and model leases. Does not query containers.
     */
    @GetMapping
    public Map<String, Object> status() {
        Map<String, Object> services = new LinkedHashMap<>();
        for (Map.Entry<String, ServiceState> entry : registry.snapshot().entrySet()) {
            String name = entry.getKey();
            ServiceState state = entry.getValue();
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("desired", state.desired().name());
            info.put("actual", state.actual().name());
            info.put("lastUsed", state.lastUsed() != null ? state.lastUsed().toString() : null);
            info.put("idleEligible", catalog.isIdleEligible(name));
            info.put("dependencies", List.copyOf(catalog.getDependencies(name)));
            services.put(name, info);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("autoWakeEnabled", lifecycle.isEnabled());
        result.put("idleSleepEnabled", properties.isIdleEnabled());
        result.put("idleTimeoutMinutes", properties.getIdleTimeout().toMinutes());
        result.put("idleCheckIntervalSeconds", properties.getIdleCheckInterval().toSeconds());
        result.put("modelKeepAliveSeconds", leases.getDefaultKeepAlive().toSeconds());
        result.put("startupOrder", catalog.startupOrder());
        result.put("services", services);
        result.put("modelLeases", leases.snapshot());
        return result;
    }

    /**
     * GET /api/v1/services/{name}/health: Fresh health evaluation.
     */
    @GetMapping("/{name}/health")
    public Map<String, Object> health(@PathVariable String name) {
        HealthState state = healthChecker.health(name);
        return Map.of("service", name, "state", state.name());
    }

    /**
     * POST /api/v1/services/{name}/ensure: Start the service and its dependencies if needed.
     * Returns 503 when it could not be made ready.
     */
    @PostMapping("/{name}/ensure")
    public ResponseEntity<Map<String, Object>> ensure(@PathVariable String name) {
        boolean ready = lifecycle.ensureReady(name);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", name);
        body.put("ready", ready);
        return ready ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    /**
     * POST /api/v1/services/ensure: Ensure several services, body is a JSON array of names.
     */
    @PostMapping("/ensure")
    public ResponseEntity<Map<String, Object>> ensureAll(@RequestBody List<String> names) {
        List<String> resolved = resolver.resolve(names);
        boolean ready = lifecycle.ensureMultipleReady(names);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("services", names);
        body.put("resolved", resolved);
        body.put("ready", ready);
        return ready ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    /**
     * POST /api/v1/services/{name}/actions/{action}: Manual start, stop or restart.
     */
    @PostMapping("/{name}/actions/{action}")
    public ResponseEntity<Map<String, Object>> action(@PathVariable String name, @PathVariable String action) {
        boolean success;
        switch (action) {
            case "start" -> success = lifecycle.start(name);
            case "stop" -> success = lifecycle.stop(name);
            case "restart" -> success = lifecycle.restart(name);
            default -> {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid action: " + action));
            }
        }
        log.info("Admin {} of {}: {}", action, name, success ? "ok" : "failed");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", name);
        body.put("action", action);
        body.put("status", success ? "success" : "failed");
        return success ? ResponseEntity.ok(body) : ResponseEntity.internalServerError().body(body);
    }

    /**
     * PUT /api/v1/services/{name}/desired?state=ON|OFF: Pin or unpin a service against idle stops.
     */
    @PutMapping("/{name}/desired")
    public Map<String, Object> desired(@PathVariable String name, @RequestParam DesiredState state) {
        registry.setDesired(name, state);
        return Map.of("service", name, "desired", registry.get(name).desired().name());
    }
}
