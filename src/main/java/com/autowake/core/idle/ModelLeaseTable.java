package com.autowake.core.idle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keep-alive leases of loaded inference models. A model without an entry has no lease.
 */
public class ModelLeaseTable {

    private static final Logger log = LoggerFactory.getLogger(ModelLeaseTable.class);

    private final ConcurrentHashMap<String, Instant> leases = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultKeepAlive;

    public ModelLeaseTable(Clock clock, Duration defaultKeepAlive) {
        this.clock = clock;
        this.defaultKeepAlive = defaultKeepAlive;
    }

    public ModelLease register(String modelName) {
        return register(modelName, defaultKeepAlive);
    }

    /**
     * Creates or renews a lease running {@code keepAlive} from now. A zero or negative duration
     * drops the lease instead.
     *
     * @return the lease now in force, or {@code null} when dropped
     */
    public ModelLease register(String modelName, Duration keepAlive) {
        Objects.requireNonNull(modelName, "modelName");
        if (keepAlive == null || keepAlive.isZero() || keepAlive.isNegative()) {
            leases.remove(modelName);
            log.debug("Keep-alive lease for {} dropped", modelName);
            return null;
        }
        Instant until = clock.instant().plus(keepAlive);
        leases.put(modelName, until);
        log.debug("Model {} kept alive until {}", modelName, until);
        return new ModelLease(modelName, until);
    }

    /** Leases whose keep-alive has elapsed at {@code now}. */
    public List<ModelLease> expired(Instant now) {
        var result = new ArrayList<ModelLease>();
        leases.forEach((model, until) -> {
            var lease = new ModelLease(model, until);
            if (lease.isExpired(now)) result.add(lease);
        });
        result.sort(Comparator.comparing(ModelLease::keepAliveUntil));
        return result;
    }

    /**
     * Removes a lease only if it still ends at the given instant, so a renewal that raced
     * with an unload survives.
     */
    public boolean clear(ModelLease lease) {
        return leases.remove(lease.modelName(), lease.keepAliveUntil());
    }

    public List<ModelLease> snapshot() {
        var result = new ArrayList<ModelLease>();
        leases.forEach((model, until) -> result.add(new ModelLease(model, until)));
        result.sort(Comparator.comparing(ModelLease::modelName));
        return result;
    }

    public Duration getDefaultKeepAlive() {
        return defaultKeepAlive;
    }
}
