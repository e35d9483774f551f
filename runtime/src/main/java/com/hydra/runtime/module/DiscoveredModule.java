package com.hydra.runtime.module;

import com.hydra.config.ModuleDescriptor;

import java.util.Objects;

/**
 * A module found by a {@link ModuleSource}: its loadable handle plus its descriptor.
 */
public final class DiscoveredModule {

    private final ModuleDescriptor descriptor;
    private final ModuleFactory factory;

    public DiscoveredModule(ModuleDescriptor descriptor, ModuleFactory factory) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public String getName() {
        return descriptor.getName();
    }

    public ModuleDescriptor getDescriptor() {
        return descriptor;
    }

    public ModuleFactory getFactory() {
        return factory;
    }

    @Override
    public String toString() {
        return "DiscoveredModule{" + descriptor.getName() + '}';
    }
}
