package com.hydra.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler backed by one daemon thread named {@code hydra-runtime}.
 *
 * <p>Tasks submitted after {@link #shutdown()} are dropped with a debug log, since retry
 * timers routinely fire after the runtime has been stopped.</p>
 */
public class EventLoopScheduler implements RuntimeScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

    public static final String THREAD_NAME = "hydra-runtime";

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread runtimeThread;

    public EventLoopScheduler() {
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            runtimeThread = thread;
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        schedule(task, Duration.ZERO);
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        try {
            executor.schedule(() -> runSafely(task), Math.max(0L, delay.toNanos()), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler is shut down, dropping task");
        }
    }

    @Override
    public boolean inRuntimeThread() {
        return Thread.currentThread() == runtimeThread;
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
        log.info("Runtime scheduler stopped");
    }

    /**
     * Check if {@link #shutdown()} has been called.
     */
    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Wait for the runtime thread to finish after {@link #shutdown()}.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Uncaught error in runtime task", t);
        }
    }
}
