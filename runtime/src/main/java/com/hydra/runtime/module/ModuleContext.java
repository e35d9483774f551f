package com.hydra.runtime.module;

import com.hydra.config.ModuleDescriptor;
import com.typesafe.config.Config;

import java.util.Optional;

/**
 * What a {@link ModuleFactory} sees while creating its module.
 */
public interface ModuleContext {

    String getName();

    ModuleDescriptor getDescriptor();

    /**
     * Get the module's configuration block ({@code hydra.modules."<name>"}).
     */
    default Config getConfig() {
        return getDescriptor().getModuleConfig();
    }

    /**
     * Get an already loaded module without triggering a load.
     */
    Optional<ModuleInstance> dependency(String name);

    /**
     * Get a module, loading it first if it is not cached yet.
     *
     * @param name the module name
     * @return the loaded instance
     * @throws com.hydra.runtime.DependencyCycleException if the module is currently being loaded
     * @throws IllegalStateException if the module could not be loaded
     */
    ModuleInstance require(String name) throws Exception;

    /**
     * Get a module's value, loading it first if needed.
     */
    default <T> T require(String name, Class<T> type) throws Exception {
        return require(name).getValue(type);
    }
}
