package com.questrail.hamgateway.message;

import com.questrail.hamgateway.buffer.OwnedBuffer;
import com.questrail.hamgateway.server.CancellationSignal;

import java.net.InetSocketAddress;

/**
 * Message-processing entry point invoked by listeners for every accepted payload.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations MUST NOT throw. Every failure is reported to an
 *       observability sink and the payload is dropped.</li>
 *   <li>The payload is owned by the caller and released after this method
 *       returns. Implementations MUST NOT retain it.</li>
 *   <li>The sender is always present.</li>
 * </ul>
 */
@FunctionalInterface
public interface MessageProcessor
{
    void process(OwnedBuffer payload, InetSocketAddress sender, CancellationSignal cancellation);
}
