package com.questrail.hamgateway.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for operational correctness.</strong> Use
 * {@link MonotonicClock} for anything that measures elapsed time.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
