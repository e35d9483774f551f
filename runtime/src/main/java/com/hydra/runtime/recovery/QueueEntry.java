package com.hydra.runtime.recovery;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.RetryOptions;
import com.hydra.runtime.retry.RetryRequest;

/**
 * A deferred attempt waiting for the recovery queue to drain.
 */
public final class QueueEntry<T> {

    public static final int CRITICAL_PRIORITY = 1;
    public static final int DEFAULT_PRIORITY = 5;

    private final int priority;
    private final RetryRequest<T> request;
    private final int retryCount;
    private final RetryOptions options;
    private final long sequence;

    QueueEntry(RetryRequest<T> request, int retryCount, RetryOptions options, long sequence) {
        this.priority = request.isCritical() ? CRITICAL_PRIORITY : DEFAULT_PRIORITY;
        this.request = request;
        this.retryCount = retryCount;
        this.options = options;
        this.sequence = sequence;
    }

    /**
     * Get the drain priority; lower runs first.
     */
    public int getPriority() {
        return priority;
    }

    public String getModuleName() {
        return request.getModuleName();
    }

    public LifecyclePhase getPhase() {
        return request.getPhase();
    }

    public RetryRequest<T> getRequest() {
        return request;
    }

    /**
     * Get the number of attempts already made when the entry was queued.
     */
    public int getRetryCount() {
        return retryCount;
    }

    /**
     * Get the retry options in effect when the entry was queued.
     */
    public RetryOptions getOptions() {
        return options;
    }

    long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "QueueEntry{module='" + getModuleName() + "', phase=" + getPhase()
               + ", priority=" + priority + ", retryCount=" + retryCount + '}';
    }
}
