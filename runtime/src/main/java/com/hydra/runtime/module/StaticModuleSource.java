package com.hydra.runtime.module;

import com.hydra.config.HydraConfig;
import com.hydra.config.Location;
import com.hydra.config.ModuleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Module source populated in code, for embedding and tests.
 *
 * <p>A module registered by name takes its descriptor from the configuration when one is
 * present there, and the default descriptor otherwise.</p>
 *
 * <pre>{@code
 * StaticModuleSource source = new StaticModuleSource(config)
 *     .register("Data.ProfileLoader", ctx -> ModuleInstance.of(ctx.getName(), new ProfileLoader()))
 *     .register(ModuleDescriptor.builder("Data.DataManager").dependsOn("Data.ProfileLoader").build(),
 *               new DataManagerFactory());
 * }</pre>
 */
public class StaticModuleSource implements ModuleSource {

    private static final Logger log = LoggerFactory.getLogger(StaticModuleSource.class);

    private final HydraConfig config;
    private final Map<String, DiscoveredModule> modules = new LinkedHashMap<>();

    public StaticModuleSource() {
        this(null);
    }

    /**
     * @param config configuration to take descriptors from, may be {@code null}
     */
    public StaticModuleSource(HydraConfig config) {
        this.config = config;
    }

    /**
     * Register a module under the descriptor configured for its name.
     */
    public StaticModuleSource register(String name, ModuleFactory factory) {
        String normalized = name.trim();
        ModuleDescriptor descriptor = config != null
                ? config.getDescriptor(normalized).orElseGet(() -> ModuleDescriptor.defaults(normalized))
                : ModuleDescriptor.defaults(normalized);
        return register(descriptor, factory);
    }

    /**
     * Register a module with an explicit descriptor.
     */
    public synchronized StaticModuleSource register(ModuleDescriptor descriptor, ModuleFactory factory) {
        String name = descriptor.getName().trim();
        if (modules.containsKey(name)) {
            log.warn("Module '{}' is already registered, ignoring duplicate", name);
            return this;
        }
        modules.put(name, new DiscoveredModule(descriptor, factory));
        log.debug("Registered module '{}'", name);
        return this;
    }

    @Override
    public synchronized List<DiscoveredModule> discover(Location side) {
        List<DiscoveredModule> visible = new ArrayList<>();
        for (DiscoveredModule module : modules.values()) {
            ModuleDescriptor descriptor = module.getDescriptor();
            if (descriptor.isEnabled() && descriptor.getLocation().isVisibleFrom(side)) {
                visible.add(module);
            } else {
                log.debug("Module '{}' excluded from side {}", module.getName(), side);
            }
        }
        return visible;
    }
}
