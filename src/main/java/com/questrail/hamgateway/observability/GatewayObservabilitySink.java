package com.questrail.hamgateway.observability;

/**
 * Main interface for receiving gateway observability events.
 *
 * <p>Listeners and the message router never log directly; every drop,
 * rejection and fault is reported here. Implementations can provide logging,
 * metrics, or test recording. Implementations must be thread-safe: events
 * arrive concurrently from I/O threads and processing threads.</p>
 */
public interface GatewayObservabilitySink {
    /**
     * Called on listener lifecycle changes and stream-level warnings.
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an inbound datagram or connection is refused before decoding.
     * @param event the rejection details
     */
    void onSourceRejected(SourceRejectedEvent event);

    /**
     * Called when a received payload is dropped by the message router.
     * @param event the drop details
     */
    void onMessageDropped(MessageDroppedEvent event);

    /**
     * Called when an unexpected fault is caught by a listener or processor.
     * @param event the error event
     */
    void onError(GatewayErrorEvent event);
}
