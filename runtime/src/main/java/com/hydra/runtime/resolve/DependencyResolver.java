package com.hydra.runtime.resolve;

import com.hydra.config.HydraConfigException;
import com.hydra.runtime.DependencyCycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Orders modules so that every module comes after its dependencies.
 *
 * <p>Kahn's algorithm: modules whose dependencies are all placed become ready, and ready
 * modules are placed first-in first-out in input order, so the result is deterministic.
 * A dependency outside the working set is external: it is ignored with a warning, or
 * rejected under strict mode.</p>
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final boolean strict;

    public DependencyResolver(boolean strict) {
        this.strict = strict;
    }

    /**
     * Resolve a load order.
     *
     * @param names the working set, in discovery order
     * @param dependenciesOf the declared dependencies of a module
     * @return the order, or a cyclic result in lenient mode
     * @throws HydraConfigException in strict mode, if a dependency is outside the working set
     * @throws DependencyCycleException in strict mode, if the graph has a cycle
     */
    public ResolutionResult resolve(List<String> names, Function<String, List<String>> dependenciesOf) {
        Set<String> workingSet = new LinkedHashSet<>(names);

        // Remaining dependency count per module, and who is waiting on each module
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String name : workingSet) {
            inDegree.put(name, 0);
        }

        for (String name : workingSet) {
            List<String> declared = dependenciesOf.apply(name);
            if (declared == null) {
                continue;
            }
            for (String dep : new LinkedHashSet<>(declared)) {
                if (!workingSet.contains(dep)) {
                    if (strict) {
                        throw new HydraConfigException("Module '" + name + "' depends on unknown module '" + dep + "'");
                    }
                    log.warn("Module '{}' depends on '{}', which is not registered; ignoring", name, dep);
                    continue;
                }
                inDegree.merge(name, 1, Integer::sum);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(name);
            }
        }

        // Find nodes with no dependencies
        Deque<String> ready = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        // Process nodes in order
        List<String> order = new ArrayList<>(workingSet.size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String dependent : dependents.getOrDefault(node, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != workingSet.size()) {
            Set<String> unresolved = new LinkedHashSet<>(workingSet);
            order.forEach(unresolved::remove);
            if (strict) {
                throw new DependencyCycleException(unresolved);
            }
            log.warn("Circular dependency detected in modules: {}", unresolved);
            return ResolutionResult.cyclic(order, unresolved);
        }

        log.debug("Resolved load order: {}", order);
        return ResolutionResult.ordered(order);
    }
}
