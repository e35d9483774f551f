package com.hydra.config;

import java.util.Locale;

/**
 * What the registry does when a module name is registered twice.
 */
public enum DuplicatePolicy {

    /**
     * Keep the first registration and log a warning.
     */
    SKIP,

    /**
     * Fail the registration with a {@link HydraConfigException}.
     */
    REJECT;

    public static DuplicatePolicy parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new HydraConfigException("Unknown duplicate policy '" + value + "', expected skip or reject");
        }
    }
}
