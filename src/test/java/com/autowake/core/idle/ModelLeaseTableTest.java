package com.autowake.core.idle;

import com.autowake.core.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelLeaseTableTest {

    private static final Instant START = Instant.parse("2026-05-04T09:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final ModelLeaseTable leases = new ModelLeaseTable(clock, Duration.ofHours(2));

    @Test
    void registerUsesDefaultKeepAlive() {
        ModelLease lease = leases.register("llama3");
        assertEquals(START.plus(Duration.ofHours(2)), lease.keepAliveUntil());
    }

    @Test
    void renewalExtendsTheLease() {
        leases.register("llama3", Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(5));
        leases.register("llama3", Duration.ofMinutes(10));

        assertEquals(START.plus(Duration.ofMinutes(15)), leases.snapshot().get(0).keepAliveUntil());
    }

    @Test
    void zeroKeepAliveDropsTheLease() {
        leases.register("llama3");
        assertNull(leases.register("llama3", Duration.ZERO));
        assertTrue(leases.snapshot().isEmpty());
    }

    @Test
    void expiredReturnsOnlyElapsedLeasesOldestFirst() {
        leases.register("b", Duration.ofMinutes(20));
        leases.register("a", Duration.ofMinutes(10));
        leases.register("c", Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(30));

        List<ModelLease> expired = leases.expired(clock.instant());

        assertEquals(List.of("a", "b"), expired.stream().map(ModelLease::modelName).toList());
    }

    @Test
    void leaseIsNotExpiredAtItsExactEnd() {
        leases.register("a", Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(10));
        assertTrue(leases.expired(clock.instant()).isEmpty());
    }

    @Test
    void clearIgnoresRenewedLease() {
        ModelLease old = leases.register("llama3", Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));
        leases.register("llama3");

        assertFalse(leases.clear(old));
        assertEquals(1, leases.snapshot().size());
    }

    @Test
    void clearRemovesMatchingLease() {
        ModelLease lease = leases.register("llama3", Duration.ofMinutes(1));
        assertTrue(leases.clear(lease));
        assertTrue(leases.snapshot().isEmpty());
    }
}
