package com.questrail.hamgateway.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a payload that reached the message router but was not
 * delivered to a handler operation.
 *
 * @param tag    the lower-cased root tag, or {@code null} if it could not be read
 * @param detail context for the drop; for validation failures this is the
 *               offending message
 */
public record MessageDroppedEvent(
    Instant timestamp,
    SocketAddress sender,
    Reason reason,
    String tag,
    String detail
) {
    public enum Reason {
        MALFORMED_PAYLOAD,
        UNKNOWN_TAG,
        DECODE_FAILED,
        VALIDATION_FAILED,
        UNHANDLED_TYPE,
        NOT_STARTED
    }
}
