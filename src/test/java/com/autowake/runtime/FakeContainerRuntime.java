package com.autowake.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory container runtime that records every call in order.
 */
public class FakeContainerRuntime implements ContainerRuntimeAdapter {

    private final Set<String> running = Collections.synchronizedSet(new HashSet<>());
    private final Set<String> failingStarts = new HashSet<>();
    private final Set<String> startsWithoutRunning = new HashSet<>();
    private final Set<String> unreachable = new HashSet<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeContainerRuntime running(String... services) {
        running.addAll(List.of(services));
        return this;
    }

    /** start() returns false for these. */
    public FakeContainerRuntime failStart(String service) {
        failingStarts.add(service);
        return this;
    }

    /** start() is accepted but the container never comes up. */
    public FakeContainerRuntime neverComesUp(String service) {
        startsWithoutRunning.add(service);
        return this;
    }

    /** status() answers UNKNOWN for these. */
    public FakeContainerRuntime unreachable(String service) {
        unreachable.add(service);
        return this;
    }

    public boolean isRunning(String service) {
        return running.contains(service);
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public List<String> starts() {
        return calls().stream().filter(c -> c.startsWith("start:")).map(c -> c.substring(6)).toList();
    }

    public List<String> stops() {
        return calls().stream().filter(c -> c.startsWith("stop:")).map(c -> c.substring(5)).toList();
    }

    @Override
    public ContainerStatus status(String serviceName) {
        calls.add("status:" + serviceName);
        if (unreachable.contains(serviceName)) return ContainerStatus.UNKNOWN;
        return running.contains(serviceName) ? ContainerStatus.RUNNING : ContainerStatus.STOPPED;
    }

    @Override
    public boolean start(String serviceName) {
        calls.add("start:" + serviceName);
        if (failingStarts.contains(serviceName)) return false;
        if (!startsWithoutRunning.contains(serviceName)) running.add(serviceName);
        return true;
    }

    @Override
    public boolean stop(String serviceName) {
        calls.add("stop:" + serviceName);
        running.remove(serviceName);
        return true;
    }
}
