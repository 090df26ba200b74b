package com.questrail.hamgateway.guard;

import com.questrail.hamgateway.internal.time.Cancellable;
import com.questrail.hamgateway.internal.time.MonotonicClock;
import com.questrail.hamgateway.internal.time.MonotonicScheduler;

import java.net.InetAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RateLimiter
 * =============================================================================
 * Per-source request limiter: at most {@code maxRequests} accepted requests
 * per source address within any {@code window}.
 *
 * <h2>State</h2>
 * One {@link RequestWindow} per source, created lazily on the first request
 * from that source. Windows of sources that have been silent for longer than
 * {@code expiry} are removed by {@link #sweepExpired()}, which
 * {@link #scheduleSweeps(MonotonicScheduler, Duration)} runs periodically
 * regardless of traffic.
 *
 * <h2>Concurrency</h2>
 * Windows live in a {@link ConcurrentHashMap}. A request and a sweep of the
 * same source both run inside the map's per-key compute, so a sweep can never
 * discard a window between its lookup and the acquisition recorded on it.
 * Requests from unrelated sources never contend on a shared lock.
 *
 * <h2>Time</h2>
 * All decisions use the supplied {@link MonotonicClock}.
 */
public final class RateLimiter
{
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);
    public static final Duration DEFAULT_EXPIRY = Duration.ofMinutes(15);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

    private static final long MIN_EVICTION_INTERVAL_NANOS = Duration.ofMillis(1).toNanos();

    private final int maxRequests;
    private final long windowNanos;
    private final long evictionIntervalNanos;
    private final long expiryNanos;
    private final MonotonicClock clock;

    private final ConcurrentMap<InetAddress, RequestWindow> windows = new ConcurrentHashMap<>();

    public RateLimiter(int maxRequests, Duration window, Duration expiry, MonotonicClock clock)
    {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(expiry, "expiry");
        this.clock = Objects.requireNonNull(clock, "clock");

        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (expiry.compareTo(window) < 0) {
            throw new IllegalArgumentException("expiry must not be shorter than the window");
        }

        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.evictionIntervalNanos = Math.max(MIN_EVICTION_INTERVAL_NANOS, windowNanos / 60);
        this.expiryNanos = expiry.toNanos();
    }

    /**
     * Creates a limiter allowing {@code maxRequests} per minute per source with
     * the default 15 minute inactivity expiry.
     */
    public static RateLimiter perMinute(int maxRequests, MonotonicClock clock)
    {
        return new RateLimiter(maxRequests, DEFAULT_WINDOW, DEFAULT_EXPIRY, clock);
    }

    /**
     * Records a request from {@code source} if it is within the limit.
     *
     * @return {@code true} if the request is accepted; {@code false} if the
     *         source has exhausted its allowance for the current window
     */
    public boolean allowRequest(InetAddress source)
    {
        InetAddress key = SourceAddresses.normalize(source);
        long now = clock.nowNanos();

        boolean[] accepted = new boolean[1];
        windows.compute(key, (k, window) -> {
            RequestWindow w = window != null
                ? window
                : new RequestWindow(maxRequests, windowNanos, evictionIntervalNanos, now);
            accepted[0] = w.tryAcquire(now);
            return w;
        });
        return accepted[0];
    }

    /**
     * Removes the state of every source inactive for longer than the expiry.
     *
     * @return number of sources removed
     */
    public int sweepExpired()
    {
        long now = clock.nowNanos();
        int removed = 0;
        for (InetAddress key : windows.keySet()) {
            boolean[] stale = new boolean[1];
            windows.computeIfPresent(key, (k, w) -> {
                stale[0] = now - w.lastAccessedNanos() > expiryNanos;
                return stale[0] ? null : w;
            });
            if (stale[0]) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Runs {@link #sweepExpired()} every {@code interval} on {@code scheduler}
     * until the returned handle is cancelled.
     */
    public Cancellable scheduleSweeps(MonotonicScheduler scheduler, Duration interval)
    {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }

        SweepSchedule schedule = new SweepSchedule(scheduler, interval);
        schedule.arm();
        return schedule;
    }

    /**
     * Number of sources that currently have state.
     */
    public int trackedSources()
    {
        return windows.size();
    }

    public int maxRequests()
    {
        return maxRequests;
    }

    /**
     * Self-rearming sweep: each run schedules the next one.
     */
    private final class SweepSchedule implements Cancellable, Runnable
    {
        private final MonotonicScheduler scheduler;
        private final Duration interval;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile Cancellable pending;

        private SweepSchedule(MonotonicScheduler scheduler, Duration interval)
        {
            this.scheduler = scheduler;
            this.interval = interval;
        }

        void arm()
        {
            if (!cancelled.get()) {
                pending = scheduler.scheduleAfter(interval, clock, this);
            }
        }

        @Override
        public void run()
        {
            if (cancelled.get()) {
                return;
            }
            sweepExpired();
            arm();
        }

        @Override
        public boolean cancel()
        {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            Cancellable p = pending;
            if (p != null) {
                p.cancel();
            }
            return true;
        }
    }
}
