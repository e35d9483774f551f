package com.hydra.runtime.resolve;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a dependency resolution: a total order, or the set of modules a cycle left
 * unresolved.
 */
public final class ResolutionResult {

    private final List<String> order;
    private final Set<String> unresolved;

    private ResolutionResult(List<String> order, Set<String> unresolved) {
        this.order = List.copyOf(order);
        this.unresolved = Collections.unmodifiableSet(new LinkedHashSet<>(unresolved));
    }

    public static ResolutionResult ordered(List<String> order) {
        return new ResolutionResult(order, Set.of());
    }

    /**
     * @param partialOrder the names that could be ordered before the cycle blocked progress
     * @param unresolved the names in, or depending on, a cycle
     */
    public static ResolutionResult cyclic(List<String> partialOrder, Set<String> unresolved) {
        return new ResolutionResult(partialOrder, unresolved);
    }

    public boolean isCyclic() {
        return !unresolved.isEmpty();
    }

    /**
     * Get the load order. For a cyclic result, only the names ordered before the cycle.
     */
    public List<String> getOrder() {
        return order;
    }

    public Set<String> getUnresolved() {
        return unresolved;
    }

    @Override
    public String toString() {
        return isCyclic() ? "ResolutionResult{cyclic=" + unresolved + '}' : "ResolutionResult{order=" + order + '}';
    }
}
