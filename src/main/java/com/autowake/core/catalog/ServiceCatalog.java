package com.autowake.core.catalog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from logical service names to their descriptors.
 *
 * <p>Unknown names are treated permissively: they have no dependencies and are
 * idle-eligible, so a gap in configuration never blocks a caller.
 */
public class ServiceCatalog {

    private final Map<String, ServiceDescriptor> descriptors;
    private final List<String> startupOrder;
    private final Set<String> pinnedOn;

    public ServiceCatalog(Collection<ServiceDescriptor> descriptors,
                          List<String> startupOrder,
                          Collection<String> pinnedOn) {
        var byName = new LinkedHashMap<String, ServiceDescriptor>();
        for (ServiceDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate service in catalog: " + descriptor.name());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byName);
        this.startupOrder = startupOrder != null ? List.copyOf(startupOrder) : List.of();
        this.pinnedOn = pinnedOn != null ? Set.copyOf(pinnedOn) : Set.of();
    }

    public Optional<ServiceDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    public Set<String> getDependencies(String name) {
        ServiceDescriptor descriptor = descriptors.get(name);
        return descriptor != null ? descriptor.dependencies() : Set.of();
    }

    public boolean isIdleEligible(String name) {
        ServiceDescriptor descriptor = descriptors.get(name);
        return descriptor == null || descriptor.idleEligible();
    }

    public boolean isPinnedOn(String name) {
        return pinnedOn.contains(name);
    }

    /** Service names in declaration order. */
    public List<String> serviceNames() {
        return List.copyOf(descriptors.keySet());
    }

    public Collection<ServiceDescriptor> descriptors() {
        return descriptors.values();
    }

    public List<String> startupOrder() {
        return startupOrder;
    }

    public Set<String> pinnedOn() {
        return pinnedOn;
    }

    /**
     * Finds one dependency cycle, if any.
     *
     * @return the services forming the cycle, first element repeated at the end
     */
    public Optional<List<String>> findCycle() {
        Map<String, Integer> color = new HashMap<>(); // 1 = on stack, 2 = done
        for (String root : descriptors.keySet()) {
            if (color.containsKey(root)) continue;

            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            path.push(root);
            pending.push(getDependencies(root).iterator());
            color.put(root, 1);

            while (!pending.isEmpty()) {
                var it = pending.peek();
                if (!it.hasNext()) {
                    color.put(path.pop(), 2);
                    pending.pop();
                    continue;
                }
                String dep = it.next();
                Integer state = color.get(dep);
                if (state == null) {
                    color.put(dep, 1);
                    path.push(dep);
                    pending.push(getDependencies(dep).iterator());
                } else if (state == 1) {
                    List<String> cycle = new ArrayList<>();
                    List<String> stack = new ArrayList<>(path);
                    Collections.reverse(stack);
                    cycle.addAll(stack.subList(stack.indexOf(dep), stack.size()));
                    cycle.add(dep);
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    /** Names referenced as dependencies but not declared in the catalog. */
    public Set<String> undeclaredDependencies() {
        Set<String> missing = new HashSet<>();
        for (ServiceDescriptor descriptor : descriptors.values()) {
            for (String dep : descriptor.dependencies()) {
                if (!descriptors.containsKey(dep)) missing.add(dep);
            }
        }
        return missing;
    }
}
