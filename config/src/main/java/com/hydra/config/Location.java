package com.hydra.config;

import java.util.Locale;

/**
 * Where a module is allowed to run.
 */
public enum Location {

    /**
     * Server-side only.
     */
    SERVER,

    /**
     * Client-side only.
     */
    CLIENT,

    /**
     * Runs on both sides.
     */
    SHARED;

    /**
     * Check if a module with this location may run on the given runtime side.
     *
     * @param side the side the runtime is executing on
     * @return true if the module is visible from that side
     */
    public boolean isVisibleFrom(Location side) {
        return this == SHARED || this == side;
    }

    /**
     * Parse a location name, ignoring case.
     *
     * @param value the configured value, e.g. {@code "Server"}
     * @return the location
     * @throws HydraConfigException if the value is not a known location
     */
    public static Location parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new HydraConfigException("Unknown location '" + value + "', expected Server, Client or Shared");
        }
    }
}
