package com.questrail.hamgateway.observability;

import java.time.Instant;

/**
 * Record representing an unexpected fault that was caught and contained.
 */
public record GatewayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
