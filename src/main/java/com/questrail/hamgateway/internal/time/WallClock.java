package com.questrail.hamgateway.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for rate limiting or expiry decisions.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
