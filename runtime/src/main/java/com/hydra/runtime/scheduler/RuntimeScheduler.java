package com.hydra.runtime.scheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * The single logical thread that owns all registry mutation.
 *
 * <p>Every continuation of a lifecycle or retry chain is executed through the scheduler,
 * so module state is never touched concurrently. Implementations must run tasks one at a
 * time, in submission order for equal deadlines.</p>
 */
public interface RuntimeScheduler extends Executor {

    /**
     * Run a task as soon as possible, after any task already queued.
     */
    @Override
    void execute(Runnable task);

    /**
     * Run a task after a delay.
     *
     * @param task the task
     * @param delay the delay, zero or positive
     */
    void schedule(Runnable task, Duration delay);

    /**
     * Check if the calling thread is the scheduler's thread.
     */
    boolean inRuntimeThread();

    /**
     * Stop accepting tasks. Pending delayed tasks are discarded.
     */
    void shutdown();
}
