package com.hydra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runtime-wide settings and module descriptors, parsed from the {@code hydra} block.
 *
 * <p>Expected format (defaults live in {@code reference.conf}):</p>
 * <pre>{@code
 * hydra {
 *   location = server
 *   strict-validation = true
 *   use-recovery-queue = true
 *   critical-background-retries = false
 *   duplicates = skip
 *   retry {
 *     general    { initial-wait = 1s, max-attempts = 5 }
 *     background { initial-wait = 2s, max-attempts = 10, jitter = true }
 *     start      { max-attempts = 3, backoff = fixed }
 *   }
 *   modules { ... }
 * }
 * }</pre>
 *
 * <p>Malformed global settings throw {@link HydraConfigException} immediately. Malformed
 * module blocks are collected in {@link #getDescriptorErrors()} so that validation can
 * decide, based on {@code strict-validation}, whether they are fatal.</p>
 */
public final class HydraConfig {

    private static final Logger log = LoggerFactory.getLogger(HydraConfig.class);

    /**
     * Retry bucket keys accepted under {@code hydra.retry}.
     */
    public static final Set<String> RETRY_BUCKETS =
            Set.of("general", "background", "load", "init", "start", "stop", "runtime");

    private final Config config;
    private final Location side;
    private final boolean strictValidation;
    private final boolean useRecoveryQueue;
    private final boolean criticalBackgroundRetries;
    private final DuplicatePolicy duplicatePolicy;
    private final Map<String, RetryOverrides> retryBuckets;
    private final Map<String, ModuleDescriptor> descriptors;
    private final List<String> descriptorErrors;

    private HydraConfig(Config config, Location side, boolean strictValidation, boolean useRecoveryQueue,
                        boolean criticalBackgroundRetries, DuplicatePolicy duplicatePolicy,
                        Map<String, RetryOverrides> retryBuckets,
                        Map<String, ModuleDescriptor> descriptors, List<String> descriptorErrors) {
        this.config = config;
        this.side = side;
        this.strictValidation = strictValidation;
        this.useRecoveryQueue = useRecoveryQueue;
        this.criticalBackgroundRetries = criticalBackgroundRetries;
        this.duplicatePolicy = duplicatePolicy;
        this.retryBuckets = Collections.unmodifiableMap(retryBuckets);
        this.descriptors = Collections.unmodifiableMap(descriptors);
        this.descriptorErrors = List.copyOf(descriptorErrors);
    }

    /**
     * Parse settings from a root configuration. Missing keys fall back to the
     * {@code reference.conf} shipped with this module.
     *
     * @param rootConfig the root configuration, usually from {@link ConfigLoader}
     * @return the parsed settings
     * @throws HydraConfigException if a global setting is malformed
     */
    public static HydraConfig fromConfig(Config rootConfig) {
        Config root = rootConfig.withFallback(ConfigFactory.defaultReference()).resolve();
        Config hydra;
        try {
            hydra = root.getConfig("hydra");
        } catch (ConfigException e) {
            throw new HydraConfigException("Missing or invalid 'hydra' section: " + e.getMessage(), e);
        }

        try {
            Location side = Location.parse(hydra.getString("location"));
            if (side == Location.SHARED) {
                throw new HydraConfigException("hydra.location must be server or client, got: shared");
            }
            boolean strict = hydra.getBoolean("strict-validation");
            boolean useQueue = hydra.getBoolean("use-recovery-queue");
            boolean criticalBackground = hydra.getBoolean("critical-background-retries");
            DuplicatePolicy duplicates = DuplicatePolicy.parse(hydra.getString("duplicates"));

            Map<String, RetryOverrides> buckets = parseRetryBuckets(hydra.getConfig("retry"));

            Map<String, ModuleDescriptor> descriptors = new LinkedHashMap<>();
            List<String> errors = new ArrayList<>();
            parseModules(hydra.getConfig("modules"), descriptors, errors);

            log.info("Loaded hydra config: side={}, strict={}, recoveryQueue={}, modules={}",
                     side, strict, useQueue, descriptors.size());

            return new HydraConfig(root, side, strict, useQueue, criticalBackground, duplicates,
                                   buckets, descriptors, errors);
        } catch (ConfigException e) {
            throw new HydraConfigException("Invalid hydra settings: " + e.getMessage(), e);
        }
    }

    /**
     * Settings from {@code reference.conf} alone.
     */
    public static HydraConfig defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    private static Map<String, RetryOverrides> parseRetryBuckets(Config retry) {
        Map<String, RetryOverrides> buckets = new HashMap<>();
        for (String key : retry.root().keySet()) {
            if (!RETRY_BUCKETS.contains(key)) {
                throw new HydraConfigException("Unknown retry bucket 'hydra.retry." + key + "'");
            }
            buckets.put(key, RetryOverrides.fromConfig(retry.getConfig(key)));
        }
        return buckets;
    }

    private static void parseModules(Config modules, Map<String, ModuleDescriptor> descriptors,
                                     List<String> errors) {
        // Keys are iterated sorted so discovery order does not depend on hash order.
        Map<String, ConfigValue> blocks = new TreeMap<>(modules.root());
        for (Map.Entry<String, ConfigValue> block : blocks.entrySet()) {
            String name = block.getKey();
            try {
                if (block.getValue().valueType() != ConfigValueType.OBJECT) {
                    throw new HydraConfigException("Invalid config for " + name + ": expected an object");
                }
                ModuleDescriptor descriptor =
                        ModuleDescriptor.fromConfig(name, ((ConfigObject) block.getValue()).toConfig());
                descriptors.put(name, descriptor);
                log.debug("Loaded module descriptor: {}", descriptor);
            } catch (HydraConfigException e) {
                log.warn("Skipping module '{}': {}", name, e.getMessage());
                errors.add(e.getMessage());
            }
        }
    }

    /**
     * Resolve the retry options for one attempt cycle.
     *
     * <p>Foreground layering: built-in default &lt; {@code general} &lt; phase bucket &lt;
     * module-wide overrides &lt; module phase overrides. Once escalated to background the
     * {@code background} bucket slots in under the phase bucket, and a module
     * {@code background} block under the module phase overrides: built-in default &lt;
     * {@code general} &lt; {@code background} &lt; phase bucket &lt; module-wide overrides
     * &lt; module {@code background} overrides &lt; module phase overrides.</p>
     *
     * @param phase the phase being retried
     * @param descriptor the module's descriptor, may be {@code null}
     * @param foreground false once the module's retries have escalated to background
     * @return the effective options
     */
    public RetryOptions effectiveRetryOptions(LifecyclePhase phase, ModuleDescriptor descriptor,
                                              boolean foreground) {
        String bucketKey = phase.getBucketKey();
        RetryOptions options = RetryOptions.DEFAULT.merge(retryBuckets.get("general"));
        if (!foreground) {
            options = options.merge(retryBuckets.get("background"));
        }
        options = options.merge(retryBuckets.get(bucketKey));
        if (descriptor != null) {
            options = options.merge(descriptor.getRetryOverrides());
            if (!foreground) {
                options = options.merge(descriptor.getRetryOverrides("background"));
            }
            options = options.merge(descriptor.getRetryOverrides(bucketKey));
        }
        return options;
    }

    /**
     * Get the merged root configuration.
     */
    public Config getConfig() {
        return config;
    }

    /**
     * Get the side this runtime executes on, {@link Location#SERVER} or {@link Location#CLIENT}.
     */
    public Location getSide() {
        return side;
    }

    public boolean isStrictValidation() {
        return strictValidation;
    }

    public boolean isUseRecoveryQueue() {
        return useRecoveryQueue;
    }

    /**
     * Check if critical modules escalate to background retries after their first failure.
     */
    public boolean isCriticalBackgroundRetries() {
        return criticalBackgroundRetries;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    /**
     * Get the configured override block for a bucket, if any.
     */
    public Optional<RetryOverrides> getRetryBucket(String key) {
        return Optional.ofNullable(retryBuckets.get(key));
    }

    /**
     * Get all module descriptors, in discovery order.
     */
    public Map<String, ModuleDescriptor> getDescriptors() {
        return descriptors;
    }

    public Optional<ModuleDescriptor> getDescriptor(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    /**
     * Get the messages of module blocks that failed to parse.
     */
    public List<String> getDescriptorErrors() {
        return descriptorErrors;
    }
}
