package com.hydra.config;

/**
 * Thrown when runtime settings or module descriptors are malformed, or when
 * strict validation rejects the configured module graph.
 */
public class HydraConfigException extends HydraException {

    public HydraConfigException(String message) {
        super(message);
    }

    public HydraConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
