package com.autowake.dispatch.api;

import com.autowake.core.idle.ModelLease;
import com.autowake.core.idle.ModelLeaseTable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for inference model keep-alive leases.
 */
@RestController
@RequestMapping("/api/v1/models")
public class ModelLeaseController {

    static final Duration MAX_KEEP_ALIVE = Duration.ofDays(365);

    private final ModelLeaseTable leases;

    public ModelLeaseController(ModelLeaseTable leases) {
        this.leases = leases;
    }

    @GetMapping("/leases")
    public List<ModelLease> leases() {
        return leases.snapshot();
    }

    /**
     * POST /api/v1/models/{model}/lease: Keep a model loaded. Without {@code keepAliveSeconds}
     * the configured default applies; 0 drops the lease. Values above one year are rejected with 400.
     */
    @PostMapping("/{model}/lease")
    public ResponseEntity<Map<String, Object>> register(@PathVariable String model,
                                                        @RequestParam(required = false) Long keepAliveSeconds) {
        if (keepAliveSeconds != null && keepAliveSeconds > MAX_KEEP_ALIVE.toSeconds()) {
            return ResponseEntity.badRequest().body(Map.of("error",
                    "keepAliveSeconds must not exceed " + MAX_KEEP_ALIVE.toSeconds()));
        }
        ModelLease lease = keepAliveSeconds == null
                ? leases.register(model)
                : leases.register(model, Duration.ofSeconds(keepAliveSeconds));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("keepAliveUntil", lease != null ? lease.keepAliveUntil().toString() : null);
        return ResponseEntity.ok(body);
    }
}
