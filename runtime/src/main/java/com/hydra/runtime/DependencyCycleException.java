package com.hydra.runtime;

import com.hydra.config.HydraException;

import java.util.Set;

/**
 * Thrown when the module graph, or a load in progress, depends on itself.
 */
public class DependencyCycleException extends HydraException {

    private final Set<String> modules;

    public DependencyCycleException(Set<String> modules) {
        super("Circular dependency detected in modules: " + modules);
        this.modules = Set.copyOf(modules);
    }

    /**
     * Get the modules involved in, or blocked behind, the cycle.
     */
    public Set<String> getModules() {
        return modules;
    }
}
