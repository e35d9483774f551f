package com.hydra.runtime.testing;

import com.hydra.runtime.scheduler.RuntimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * A scheduler running in virtual time on the calling thread, for tests.
 *
 * <p>Nothing runs until {@link #runUntilIdle()} or {@link #advance(Duration)} is called.
 * Tasks run ordered by deadline, then by submission order. Every requested delay is
 * recorded so backoff schedules can be asserted without sleeping.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * ManualScheduler scheduler = new ManualScheduler();
 * Hydra hydra = Hydra.builder().config(config).scheduler(scheduler).build();
 *
 * CompletableFuture<Void> started = hydra.start();
 * scheduler.runUntilIdle();
 *
 * assertTrue(started.isDone());
 * assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), scheduler.getRequestedDelays());
 * }</pre>
 */
public class ManualScheduler implements RuntimeScheduler {

    private static final int DEFAULT_TASK_LIMIT = 100_000;

    private final PriorityQueue<ScheduledTask> tasks = new PriorityQueue<>();
    private final List<Duration> requestedDelays = new ArrayList<>();
    private Duration now = Duration.ZERO;
    private long sequence;
    private boolean shutdown;
    private boolean running;

    @Override
    public void execute(Runnable task) {
        schedule(task, Duration.ZERO);
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        if (shutdown) {
            return;
        }
        if (delay.compareTo(Duration.ZERO) > 0) {
            requestedDelays.add(delay);
        }
        Duration deadline = delay.isNegative() ? now : now.plus(delay);
        tasks.add(new ScheduledTask(deadline, sequence++, task));
    }

    @Override
    public boolean inRuntimeThread() {
        return running;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        tasks.clear();
    }

    /**
     * Run tasks, advancing virtual time to each deadline, until none remain.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if the task limit is exceeded (a retry loop that never ends)
     */
    public int runUntilIdle() {
        return runUntil(null, DEFAULT_TASK_LIMIT);
    }

    /**
     * Advance virtual time, running every task whose deadline falls within it.
     *
     * @return the number of tasks run
     */
    public int advance(Duration amount) {
        Duration target = now.plus(amount);
        int count = runUntil(target, DEFAULT_TASK_LIMIT);
        now = target;
        return count;
    }

    private int runUntil(Duration limit, int maxTasks) {
        int count = 0;
        while (!tasks.isEmpty()) {
            ScheduledTask next = tasks.peek();
            if (limit != null && next.deadline.compareTo(limit) > 0) {
                break;
            }
            tasks.poll();
            if (next.deadline.compareTo(now) > 0) {
                now = next.deadline;
            }
            if (++count > maxTasks) {
                throw new IllegalStateException("Scheduler did not become idle after " + maxTasks + " tasks");
            }
            running = true;
            try {
                next.task.run();
            } finally {
                running = false;
            }
        }
        return count;
    }

    /**
     * Get the current virtual time, measured from creation.
     */
    public Duration now() {
        return now;
    }

    /**
     * Get every positive delay requested so far, in request order.
     */
    public List<Duration> getRequestedDelays() {
        return Collections.unmodifiableList(requestedDelays);
    }

    public void clearRequestedDelays() {
        requestedDelays.clear();
    }

    /**
     * Get the number of tasks waiting to run.
     */
    public int pendingTasks() {
        return tasks.size();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private static final class ScheduledTask implements Comparable<ScheduledTask> {
        private final Duration deadline;
        private final long sequence;
        private final Runnable task;

        private ScheduledTask(Duration deadline, long sequence, Runnable task) {
            this.deadline = deadline;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public int compareTo(ScheduledTask other) {
            int byDeadline = deadline.compareTo(other.deadline);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, other.sequence);
        }
    }
}
