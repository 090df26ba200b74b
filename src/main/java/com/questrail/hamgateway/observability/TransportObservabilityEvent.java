package com.questrail.hamgateway.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a listener lifecycle change or a stream-level warning.
 *
 * @param listener name of the reporting listener (e.g. {@code "udp"})
 * @param address  local address for lifecycle kinds, remote address for
 *                 per-connection kinds; may be {@code null}
 * @param detail   free-form detail; may be {@code null}
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    String listener,
    Kind kind,
    SocketAddress address,
    String detail
) {
    public enum Kind {
        BOUND,
        STARTED,
        STOPPED,
        DISPOSED,
        PAYLOAD_TRUNCATED,
        READ_TIMED_OUT
    }

    /**
     * Whether this event reports degraded input rather than a lifecycle change.
     */
    public boolean isWarning() {
        return kind == Kind.PAYLOAD_TRUNCATED || kind == Kind.READ_TIMED_OUT;
    }
}
