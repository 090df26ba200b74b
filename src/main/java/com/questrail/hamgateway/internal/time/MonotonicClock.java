package com.questrail.hamgateway.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every elapsed-time decision in the gateway.
 *
 * <h2>Binding invariant</h2>
 * Rate-limit windows, inactivity expiry and sweep cadence MUST use a monotonic
 * time source. Wall-clock time (e.g. {@code Instant.now()}) is permitted only
 * for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
