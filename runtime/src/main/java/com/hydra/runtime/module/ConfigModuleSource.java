package com.hydra.runtime.module;

import com.hydra.config.HydraConfig;
import com.hydra.config.HydraConfigException;
import com.hydra.config.Location;
import com.hydra.config.ModuleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovers modules from the {@code hydra.modules} section, instantiating each module's
 * {@code factory} class by reflection.
 *
 * <p>Disabled modules and modules not visible from the runtime side are left out. A module
 * without a usable factory is rejected with {@link HydraConfigException} under strict
 * validation and skipped with a warning otherwise.</p>
 */
public class ConfigModuleSource implements ModuleSource {

    private static final Logger log = LoggerFactory.getLogger(ConfigModuleSource.class);

    private final HydraConfig config;
    private final ClassLoader classLoader;

    public ConfigModuleSource(HydraConfig config) {
        this(config, Thread.currentThread().getContextClassLoader());
    }

    public ConfigModuleSource(HydraConfig config, ClassLoader classLoader) {
        this.config = config;
        this.classLoader = classLoader != null ? classLoader : ConfigModuleSource.class.getClassLoader();
    }

    @Override
    public List<DiscoveredModule> discover(Location side) {
        List<DiscoveredModule> modules = new ArrayList<>();
        for (ModuleDescriptor descriptor : config.getDescriptors().values()) {
            if (!descriptor.isEnabled()) {
                log.debug("Module '{}' is disabled", descriptor.getName());
                continue;
            }
            if (!descriptor.getLocation().isVisibleFrom(side)) {
                log.debug("Module '{}' ({}) is not visible from {}", descriptor.getName(),
                          descriptor.getLocation(), side);
                continue;
            }
            try {
                modules.add(new DiscoveredModule(descriptor, createFactory(descriptor)));
            } catch (HydraConfigException e) {
                if (config.isStrictValidation()) {
                    throw e;
                }
                log.warn("Skipping module '{}': {}", descriptor.getName(), e.getMessage());
            }
        }
        log.info("Discovered {} modules from configuration for side {}", modules.size(), side);
        return modules;
    }

    private ModuleFactory createFactory(ModuleDescriptor descriptor) {
        String className = descriptor.getFactoryClassName().orElseThrow(() ->
                new HydraConfigException("Module '" + descriptor.getName() + "' has no factory class"));
        try {
            Class<?> factoryClass = Class.forName(className, true, classLoader);
            if (!ModuleFactory.class.isAssignableFrom(factoryClass)) {
                throw new HydraConfigException("Factory " + className + " for module '" + descriptor.getName()
                        + "' does not implement " + ModuleFactory.class.getSimpleName());
            }
            ModuleFactory factory = (ModuleFactory) factoryClass.getDeclaredConstructor().newInstance();
            log.debug("Created factory {} for module '{}'", factoryClass.getSimpleName(), descriptor.getName());
            return factory;
        } catch (HydraConfigException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            throw new HydraConfigException("Failed to create factory " + className + " for module '"
                    + descriptor.getName() + "': " + e, e);
        }
    }
}
