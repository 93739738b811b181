package com.autowake.core.resolve;

import com.autowake.core.catalog.ServiceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Expands a set of requested services to their full dependency closure and orders it for startup.
 *
 * <p>Ordering rules, in priority:
 * <ol>
 *   <li>a service always comes after every dependency in the closure</li>
 *   <li>ties go to the catalog's startup precedence list</li>
 *   <li>then to catalog declaration order, then to name (services missing from the catalog)</li>
 * </ol>
 * Cycles are tolerated: each service is visited once, and when a cycle blocks ordering the
 * lowest-ranked blocked service is emitted first.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final ServiceCatalog catalog;
    private final Comparator<String> rank;

    public DependencyResolver(ServiceCatalog catalog) {
        this.catalog = catalog;
        this.rank = buildRank(catalog);
    }

    /**
     * @param required services the caller needs
     * @return the dependency closure of {@code required}, each service exactly once, in startup order
     */
    public List<String> resolve(Collection<String> required) {
        Set<String> closure = closure(required);

        Map<String, Set<String>> waitingOn = new LinkedHashMap<>();
        for (String service : closure) {
            var deps = new LinkedHashSet<String>();
            for (String dep : catalog.getDependencies(service)) {
                if (!dep.equals(service) && closure.contains(dep)) deps.add(dep);
            }
            waitingOn.put(service, deps);
        }

        var ordered = new ArrayList<String>(closure.size());
        var ready = new PriorityQueue<String>(rank);
        waitingOn.forEach((service, deps) -> {
            if (deps.isEmpty()) ready.add(service);
        });

        while (ordered.size() < closure.size()) {
            String next = ready.poll();
            if (next == null) {
                next = waitingOn.keySet().stream().min(rank).orElseThrow();
                log.debug("Dependency cycle among {}, emitting {} first", waitingOn.keySet(), next);
            }
            waitingOn.remove(next);
            ordered.add(next);
            for (var entry : waitingOn.entrySet()) {
                Set<String> deps = entry.getValue();
                if (deps.remove(next) && deps.isEmpty()) {
                    ready.add(entry.getKey());
                }
            }
        }
        return ordered;
    }

    /** Transitive dependencies of one service, excluding the service itself, in startup order. */
    public List<String> resolveDependenciesOf(String service) {
        var ordered = new ArrayList<>(resolve(catalog.getDependencies(service)));
        ordered.remove(service);
        return ordered;
    }

    private Set<String> closure(Collection<String> required) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> toVisit = new ArrayDeque<>(required);
        while (!toVisit.isEmpty()) {
            String service = toVisit.pop();
            if (!visited.add(service)) continue;
            for (String dep : catalog.getDependencies(service)) {
                if (!visited.contains(dep)) toVisit.add(dep);
            }
        }
        return visited;
    }

    private static Comparator<String> buildRank(ServiceCatalog catalog) {
        Map<String, Integer> position = new HashMap<>();
        int index = 0;
        for (String service : catalog.startupOrder()) {
            position.putIfAbsent(service, index++);
        }
        for (String service : catalog.serviceNames()) {
            position.putIfAbsent(service, index++);
        }
        int unranked = index;
        return Comparator.<String>comparingInt(s -> position.getOrDefault(s, unranked))
                .thenComparing(Comparator.naturalOrder());
    }
}
