package com.questrail.hamgateway.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing an inbound datagram or connection refused by a listener
 * before any decoding took place. Nothing is ever sent back to the source.
 */
public record SourceRejectedEvent(
    Instant timestamp,
    String listener,
    SocketAddress remote,
    Reason reason,
    String detail
) {
    public enum Reason {
        NO_ENDPOINT,
        BLACKLISTED,
        RATE_LIMITED,
        EMPTY_PAYLOAD,
        OVERSIZED_PAYLOAD
    }
}
