package com.questrail.hamgateway.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} implementation backed by a
 * {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays at scheduling
 * time using the supplied {@link MonotonicClock}. Callers computing deadlines
 * must use the same clock instance.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the provided executor. Callers
 * are responsible for shutdown. Scheduling against a shut-down executor
 * propagates the executor's {@code RejectedExecutionException}.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * Creates a scheduler backed by the given executor.
     *
     * @param executor the underlying scheduled executor service
     * @param clock    the monotonic clock used for delay calculations
     */
    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        return new ScheduledFutureCancellable(future);
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link Cancellable}.
     */
    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // Never interrupt a sweep that is already running.
            return future.cancel(false);
        }
    }
}
