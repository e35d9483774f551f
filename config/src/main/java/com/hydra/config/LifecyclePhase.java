package com.hydra.config;

/**
 * Named stage of a module's lifecycle.
 *
 * <p>Each phase owns a retry bucket under {@code hydra.retry} and a matching
 * override block inside a module's own {@code retry} section.</p>
 */
public enum LifecyclePhase {

    LOAD("Load", "load"),
    INIT("Init", "init"),
    START("Start", "start"),
    STOP("Stop", "stop"),
    RUNTIME("Runtime", "runtime");

    private final String displayName;
    private final String bucketKey;

    LifecyclePhase(String displayName, String bucketKey) {
        this.displayName = displayName;
        this.bucketKey = bucketKey;
    }

    /**
     * Get the name used in log and error messages, e.g. {@code "Init"}.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Get the retry bucket key, e.g. {@code "init"}.
     */
    public String getBucketKey() {
        return bucketKey;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
