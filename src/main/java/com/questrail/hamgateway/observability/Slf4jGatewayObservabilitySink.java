package com.questrail.hamgateway.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GatewayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGatewayObservabilitySink implements GatewayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGatewayObservabilitySink.class);

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.isWarning()) {
            log.warn("[{}] {} from {}: {}",
                event.listener(), event.kind(), event.address(), event.detail());
        } else {
            log.info("[{}] Listener {} on {}", event.listener(), event.kind(), event.address());
        }
    }

    @Override
    public void onSourceRejected(SourceRejectedEvent event) {
        log.warn("[{}] Rejected {} ({}): {}",
            event.listener(), event.remote(), event.reason(), event.detail());
    }

    @Override
    public void onMessageDropped(MessageDroppedEvent event) {
        log.warn("Dropped message from {} with tag '{}' ({}): {}",
            event.sender(), event.tag(), event.reason(), event.detail());
    }

    @Override
    public void onError(GatewayErrorEvent event) {
        log.error("Gateway error: {}", event.message(), event.cause());
    }
}
