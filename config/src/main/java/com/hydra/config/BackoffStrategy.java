package com.hydra.config;

import java.util.Locale;

/**
 * How the wait between retry attempts grows.
 */
public enum BackoffStrategy {

    /**
     * Wait doubles after every failed attempt.
     */
    EXPONENTIAL,

    /**
     * Every wait equals the initial wait.
     */
    FIXED;

    public static BackoffStrategy parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new HydraConfigException("Unknown backoff strategy '" + value + "', expected exponential or fixed");
        }
    }
}
