package com.questrail.hamgateway.server;

import com.questrail.hamgateway.buffer.BufferPool;
import com.questrail.hamgateway.guard.Blacklist;
import com.questrail.hamgateway.internal.time.WallClock;
import com.questrail.hamgateway.message.MessageProcessor;
import com.questrail.hamgateway.observability.GatewayObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every listener of one gateway.
 *
 * @param processingExecutor executor that runs {@link MessageProcessor#process}
 *                           off the I/O threads
 */
public record ListenerContext(
    BufferPool bufferPool,
    Blacklist blacklist,
    MessageProcessor processor,
    Executor processingExecutor,
    GatewayObservabilitySink sink,
    WallClock wallClock
) {
    public ListenerContext {
        Objects.requireNonNull(bufferPool, "bufferPool");
        Objects.requireNonNull(blacklist, "blacklist");
        Objects.requireNonNull(processor, "processor");
        Objects.requireNonNull(processingExecutor, "processingExecutor");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(wallClock, "wallClock");
    }
}
