package com.questrail.hamgateway.guard;

import java.util.ArrayDeque;

/**
 * Per-source rate-limit state: a bounded log of acceptance timestamps.
 *
 * <p>Eviction of expired timestamps is lazy. It runs when the eviction
 * interval has passed since the previous eviction, or when the log is full
 * and a stale entry could be the only thing standing between the caller and
 * admission. The log never holds more than {@code maxRequests} entries.</p>
 *
 * <p>All mutation is guarded by this instance's monitor, so contention is
 * confined to callers sharing one source key.</p>
 */
final class RequestWindow
{
    private final int maxRequests;
    private final long windowNanos;
    private final long evictionIntervalNanos;

    private final ArrayDeque<Long> accepted;
    private long lastEvictionNanos;
    private volatile long lastAccessedNanos;

    RequestWindow(int maxRequests, long windowNanos, long evictionIntervalNanos, long nowNanos)
    {
        this.maxRequests = maxRequests;
        this.windowNanos = windowNanos;
        this.evictionIntervalNanos = evictionIntervalNanos;
        this.accepted = new ArrayDeque<>(maxRequests);
        this.lastEvictionNanos = nowNanos;
        this.lastAccessedNanos = nowNanos;
    }

    synchronized boolean tryAcquire(long nowNanos)
    {
        lastAccessedNanos = nowNanos;

        if (accepted.size() >= maxRequests || nowNanos - lastEvictionNanos >= evictionIntervalNanos) {
            evictExpired(nowNanos);
        }

        if (accepted.size() >= maxRequests) {
            return false;
        }

        accepted.addLast(nowNanos);
        return true;
    }

    synchronized int liveCount()
    {
        return accepted.size();
    }

    long lastAccessedNanos()
    {
        return lastAccessedNanos;
    }

    private void evictExpired(long nowNanos)
    {
        long cutoff = nowNanos - windowNanos;
        while (!accepted.isEmpty() && accepted.peekFirst() <= cutoff) {
            accepted.pollFirst();
        }
        lastEvictionNanos = nowNanos;
    }
}
