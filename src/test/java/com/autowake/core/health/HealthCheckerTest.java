package com.autowake.core.health;

import com.autowake.core.MutableClock;
import com.autowake.core.catalog.ReadinessProbe;
import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.catalog.ServiceDescriptor;
import com.autowake.core.registry.ServiceRegistry;
import com.autowake.runtime.ContainerRuntimeAdapter;
import com.autowake.runtime.FakeContainerRuntime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckerTest {

    private final AtomicBoolean onyxProbe = new AtomicBoolean(true);

    private final ServiceCatalog catalog = new ServiceCatalog(List.of(
            ServiceDescriptor.leaf("redis"),
            ServiceDescriptor.leaf("qdrant"),
            new ServiceDescriptor("onyx", "abs-onyx", Set.of("redis", "qdrant"), true, onyxProbe::get)
    ), List.of("redis", "qdrant", "onyx"), List.of());

    private final ServiceRegistry registry = new ServiceRegistry(catalog, new MutableClock(Instant.EPOCH));

    private HealthChecker checker(ContainerRuntimeAdapter runtime) {
        return new HealthChecker(runtime, catalog, registry);
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("stopped container wins over stopped dependencies")
        void stoppedTakesPrecedence() {
            var runtime = new FakeContainerRuntime();
            assertEquals(HealthState.STOPPED, checker(runtime).health("onyx"));
            assertEquals(List.of("status:onyx"), runtime.calls());
        }

        @Test
        void degradedWhenDependencyStopped() {
            var runtime = new FakeContainerRuntime().running("onyx", "qdrant");
            assertEquals(HealthState.DEGRADED, checker(runtime).health("onyx"));
        }

        @Test
        void unhealthyWhenProbeFails() {
            onyxProbe.set(false);
            var runtime = new FakeContainerRuntime().running("onyx", "qdrant", "redis");
            assertEquals(HealthState.UNHEALTHY, checker(runtime).health("onyx"));
        }

        @Test
        void unhealthyWhenProbeThrows() {
            ReadinessProbe failing = () -> { throw new IllegalStateException("boom"); };
            var catalog = new ServiceCatalog(
                    List.of(new ServiceDescriptor("ollama", "ollama", Set.of(), true, failing)), List.of(), List.of());
            var checker = new HealthChecker(new FakeContainerRuntime().running("ollama"), catalog,
                    new ServiceRegistry(catalog, new MutableClock(Instant.EPOCH)));

            assertEquals(HealthState.UNHEALTHY, checker.health("ollama"));
        }

        @Test
        void healthyWhenEverythingIsUp() {
            var runtime = new FakeContainerRuntime().running("onyx", "qdrant", "redis");
            assertEquals(HealthState.HEALTHY, checker(runtime).health("onyx"));
        }

        @Test
        @DisplayName("running service without probe is healthy")
        void healthyWithoutProbe() {
            var runtime = new FakeContainerRuntime().running("redis");
            assertEquals(HealthState.HEALTHY, checker(runtime).health("redis"));
        }

        @Test
        void unknownWhenRuntimeCannotAnswer() {
            var runtime = new FakeContainerRuntime().unreachable("onyx");
            assertEquals(HealthState.UNKNOWN, checker(runtime).health("onyx"));
        }

        @Test
        void unknownWhenDependencyStatusUnknown() {
            var runtime = new FakeContainerRuntime().running("onyx", "qdrant").unreachable("redis");
            assertEquals(HealthState.UNKNOWN, checker(runtime).health("onyx"));
        }

        @Test
        void unknownWhenRuntimeThrows() {
            var runtime = mock(ContainerRuntimeAdapter.class);
            when(runtime.status("redis")).thenThrow(new RuntimeException("socket closed"));

            assertEquals(HealthState.UNKNOWN, checker(runtime).health("redis"));
        }

        @Test
        void resultIsRecordedInRegistry() {
            var runtime = new FakeContainerRuntime().running("onyx", "qdrant");
            checker(runtime).health("onyx");
            assertEquals(HealthState.DEGRADED, registry.get("onyx").actual());
        }

        @Test
        void eachCallAsksTheRuntimeAgain() {
            var runtime = new FakeContainerRuntime();
            var checker = checker(runtime);
            assertEquals(HealthState.STOPPED, checker.health("redis"));
            runtime.running("redis");
            assertEquals(HealthState.HEALTHY, checker.health("redis"));
        }
    }

    @Nested
    @DisplayName("isReady")
    class IsReady {

        @Test
        void probedServiceNeedsHealthy() {
            var runtime = new FakeContainerRuntime().running("onyx", "qdrant", "redis");
            assertTrue(checker(runtime).isReady("onyx"));

            onyxProbe.set(false);
            assertFalse(checker(runtime).isReady("onyx"));
        }

        @Test
        void unprobedServiceNeedsRunningContainer() {
            var runtime = new FakeContainerRuntime().running("qdrant");
            assertTrue(checker(runtime).isReady("qdrant"));
            assertFalse(checker(runtime).isReady("redis"));
        }

        @Test
        void unknownStatusIsNeverReady() {
            var runtime = new FakeContainerRuntime().unreachable("redis");
            assertFalse(checker(runtime).isReady("redis"));
        }
    }
}
