package com.questrail.hamgateway.server;

import com.questrail.hamgateway.config.ServerConfig;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;

/**
 * ListenerTransport
 * =============================================================================
 * Protocol-specific half of a listener, supplied to {@link ServerLifecycle}.
 *
 * <p>The lifecycle owns the event loop group, the bound channel and the
 * start/stop/dispose state machine. The transport only knows how to build the
 * protocol's pipeline and bind it.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #bind} MUST configure the channel with {@code AUTO_READ}
 *       disabled. The lifecycle enables reads on start.</li>
 *   <li>{@link #onStart} runs once per start, before reads are enabled. Work
 *       started there must end when the given signal is cancelled.</li>
 * </ul>
 */
public interface ListenerTransport
{
    /**
     * Short protocol name used in events and messages ({@code "udp"}, {@code "tcp"}).
     */
    String protocol();

    /**
     * Buffer size used when the configuration does not specify one.
     */
    int defaultBufferSize();

    /**
     * Number of event loop threads the lifecycle creates for this transport.
     */
    default int ioThreads()
    {
        return 1;
    }

    /**
     * Binds the protocol's channel on {@code group}.
     *
     * @param bufferSize effective buffer size (configured or protocol default)
     */
    ChannelFuture bind(EventLoopGroup group, ServerConfig config, int bufferSize);

    default void onStart(Channel channel, CancellationSignal cancellation)
    {
    }
}
