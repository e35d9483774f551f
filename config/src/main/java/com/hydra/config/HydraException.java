package com.hydra.config;

/**
 * Base type for every failure raised by the Hydra runtime.
 *
 * <p>Unchecked: non-critical failures never reach callers as exceptions, and critical
 * ones surface as the exceptional completion of a lifecycle future.</p>
 */
public class HydraException extends RuntimeException {

    public HydraException(String message) {
        super(message);
    }

    public HydraException(String message, Throwable cause) {
        super(message, cause);
    }
}
