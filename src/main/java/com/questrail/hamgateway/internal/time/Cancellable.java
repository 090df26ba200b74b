package com.questrail.hamgateway.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled tasks and registered callbacks.
 *
 * <p>
 * Implemented by the scheduler adapters (rate-limiter sweeps) and by
 * cancellation-callback registrations on a server's cancellation signal.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task or registration.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
