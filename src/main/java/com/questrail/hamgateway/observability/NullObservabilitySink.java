package com.questrail.hamgateway.observability;

/**
 * No-op implementation of GatewayObservabilitySink.
 */
public final class NullObservabilitySink implements GatewayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onSourceRejected(SourceRejectedEvent event) {}

    @Override
    public void onMessageDropped(MessageDroppedEvent event) {}

    @Override
    public void onError(GatewayErrorEvent event) {}
}
