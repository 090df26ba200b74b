/**
 * Listener lifecycle shared by the UDP and TCP transports.
 *
 * <p>{@link com.questrail.hamgateway.server.ServerLifecycle} owns the socket,
 * the event loop and the {@code STOPPED → RUNNING → STOPPED → DISPOSED} state
 * machine; a {@link com.questrail.hamgateway.server.ListenerTransport} supplies
 * only the protocol-specific bootstrap.</p>
 */
package com.questrail.hamgateway.server;
