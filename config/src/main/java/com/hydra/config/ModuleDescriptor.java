package com.hydra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declared shape of one module, parsed from its block under {@code hydra.modules}.
 *
 * <p>Module descriptors in HOCON config look like:</p>
 * <pre>{@code
 * hydra.modules {
 *   "Data.ProfileLoader" {
 *     location = server
 *     critical = true
 *     factory = "com.example.data.ProfileLoaderFactory"
 *     retry {
 *       max-attempts = 5
 *       jitter = true
 *       init { max-attempts = 10 }
 *       background { max-attempts = 5 }
 *     }
 *   }
 *   "Data.DataManager" {
 *     location = server
 *     dependencies = ["Data.ProfileLoader"]
 *   }
 * }
 * }</pre>
 *
 * <p>Names contain dots, so they must be quoted keys in HOCON.</p>
 */
public final class ModuleDescriptor {

    /**
     * Override block keys accepted inside a module's {@code retry} section.
     */
    public static final Set<String> RETRY_BUCKETS =
            Set.of("load", "init", "start", "stop", "runtime", "background");

    private final String name;
    private final Location location;
    private final List<String> dependencies;
    private final boolean critical;
    private final boolean enabled;
    private final String factoryClassName;
    private final RetryOverrides retryOverrides;
    private final Map<String, RetryOverrides> bucketOverrides;
    private final Config moduleConfig;

    private ModuleDescriptor(Builder builder) {
        this.name = builder.name;
        this.location = builder.location;
        this.dependencies = List.copyOf(builder.dependencies);
        this.critical = builder.critical;
        this.enabled = builder.enabled;
        this.factoryClassName = builder.factoryClassName;
        this.retryOverrides = builder.retryOverrides;
        this.bucketOverrides = Collections.unmodifiableMap(new HashMap<>(builder.bucketOverrides));
        this.moduleConfig = builder.moduleConfig;
    }

    /**
     * Parse a module descriptor from configuration.
     *
     * @param name the module name (quoted key in config)
     * @param config the module's configuration block
     * @return the parsed descriptor
     * @throws HydraConfigException if a key is missing its expected type or value
     */
    public static ModuleDescriptor fromConfig(String name, Config config) {
        try {
            Builder builder = builder(name)
                    .location(config.hasPath("location")
                            ? Location.parse(config.getString("location")) : Location.SHARED)
                    .critical(config.hasPath("critical") && config.getBoolean("critical"))
                    .enabled(!config.hasPath("enabled") || config.getBoolean("enabled"))
                    .moduleConfig(config);

            if (config.hasPath("dependencies")) {
                builder.dependsOn(config.getStringList("dependencies"));
            }
            if (config.hasPath("factory")) {
                builder.factory(config.getString("factory"));
            }
            if (config.hasPath("retry")) {
                Config retry = config.getConfig("retry");
                builder.retry(RetryOverrides.fromConfig(retry));
                for (String bucket : retry.root().keySet()) {
                    if (RETRY_BUCKETS.contains(bucket)) {
                        builder.retry(bucket, RetryOverrides.fromConfig(retry.getConfig(bucket)));
                    }
                }
            }
            return builder.build();
        } catch (ConfigException e) {
            throw new HydraConfigException("Invalid descriptor for module '" + name + "': " + e.getMessage(), e);
        } catch (HydraConfigException e) {
            throw new HydraConfigException("Invalid descriptor for module '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * Descriptor used for a discovered module that has no configuration block:
     * shared, non-critical, no dependencies, no retry overrides.
     */
    public static ModuleDescriptor defaults(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Get the module's dot-path name.
     */
    public String getName() {
        return name;
    }

    public Location getLocation() {
        return location;
    }

    /**
     * Get the names of modules this module depends on, in declaration order.
     */
    public List<String> getDependencies() {
        return dependencies;
    }

    /**
     * Check if a failure of this module aborts the phase it failed in.
     */
    public boolean isCritical() {
        return critical;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Get the fully qualified factory class name, if one is configured.
     */
    public Optional<String> getFactoryClassName() {
        return Optional.ofNullable(factoryClassName);
    }

    /**
     * Get the module-wide retry overrides (keys directly under {@code retry}).
     */
    public RetryOverrides getRetryOverrides() {
        return retryOverrides;
    }

    /**
     * Get the overrides for one bucket ({@code init}, {@code background}, ...).
     *
     * @param bucketKey the bucket key
     * @return the overrides, or {@link RetryOverrides#NONE}
     */
    public RetryOverrides getRetryOverrides(String bucketKey) {
        return bucketOverrides.getOrDefault(bucketKey, RetryOverrides.NONE);
    }

    /**
     * Get the module-specific configuration block.
     */
    public Config getModuleConfig() {
        return moduleConfig;
    }

    @Override
    public String toString() {
        return "ModuleDescriptor{" +
               "name='" + name + '\'' +
               ", location=" + location +
               ", dependencies=" + dependencies +
               ", critical=" + critical +
               ", enabled=" + enabled +
               (factoryClassName != null ? ", factory='" + factoryClassName + '\'' : "") +
               '}';
    }

    /**
     * Builder for programmatically declared modules.
     */
    public static final class Builder {
        private final String name;
        private Location location = Location.SHARED;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private boolean critical;
        private boolean enabled = true;
        private String factoryClassName;
        private RetryOverrides retryOverrides = RetryOverrides.NONE;
        private final Map<String, RetryOverrides> bucketOverrides = new HashMap<>();
        private Config moduleConfig = ConfigFactory.empty();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new HydraConfigException("Module name must not be blank");
            }
            this.name = name;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder dependsOn(String... names) {
            return dependsOn(List.of(names));
        }

        public Builder dependsOn(List<String> names) {
            for (String dep : names) {
                if (dep == null || dep.isBlank()) {
                    throw new HydraConfigException("Blank dependency name in module '" + name + "'");
                }
                dependencies.add(dep);
            }
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder factory(String factoryClassName) {
            this.factoryClassName = factoryClassName;
            return this;
        }

        public Builder retry(RetryOverrides overrides) {
            this.retryOverrides = overrides;
            return this;
        }

        public Builder retry(String bucketKey, RetryOverrides overrides) {
            if (!RETRY_BUCKETS.contains(bucketKey)) {
                throw new HydraConfigException("Unknown retry bucket '" + bucketKey + "' for module '" + name + "'");
            }
            bucketOverrides.put(bucketKey, overrides);
            return this;
        }

        public Builder retry(LifecyclePhase phase, RetryOverrides overrides) {
            return retry(phase.getBucketKey(), overrides);
        }

        public Builder moduleConfig(Config moduleConfig) {
            this.moduleConfig = moduleConfig;
            return this;
        }

        public ModuleDescriptor build() {
            return new ModuleDescriptor(this);
        }
    }
}
