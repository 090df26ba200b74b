package com.questrail.hamgateway.transport.udp;

import com.questrail.hamgateway.buffer.OwnedBuffer;
import com.questrail.hamgateway.config.ServerConfig;
import com.questrail.hamgateway.guard.RateLimiter;
import com.questrail.hamgateway.internal.time.Cancellable;
import com.questrail.hamgateway.internal.time.MonotonicScheduler;
import com.questrail.hamgateway.observability.GatewayErrorEvent;
import com.questrail.hamgateway.observability.SourceRejectedEvent;
import com.questrail.hamgateway.server.CancellationSignal;
import com.questrail.hamgateway.server.LifecycleState;
import com.questrail.hamgateway.server.ListenerContext;
import com.questrail.hamgateway.server.ListenerTransport;
import com.questrail.hamgateway.server.ServerLifecycle;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * UdpListener
 * =============================================================================
 * Receives one candidate message per UDP datagram.
 *
 * <h2>Gating</h2>
 * Each datagram is checked, in order, for:
 * <ol>
 *   <li>a resolvable sender address</li>
 *   <li>a sender outside the {@link com.questrail.hamgateway.guard.Blacklist}</li>
 *   <li>a sender within its {@link RateLimiter} allowance</li>
 *   <li>a non-empty payload</li>
 *   <li>a payload no larger than the configured buffer size</li>
 * </ol>
 * A datagram failing any check is reported as a source rejection and dropped;
 * the loop continues. Nothing is ever sent back to the sender.
 *
 * <h2>Hand-off</h2>
 * Accepted payloads are copied into a right-sized {@link OwnedBuffer} and
 * dispatched through {@link ServerLifecycle#dispatch}; the receive buffer is
 * released by Netty as soon as the handler returns. The I/O thread never
 * waits for message processing.
 *
 * <h2>Oversize detection</h2>
 * The channel's receive allocator hands out buffers one byte larger than the
 * configured size. A datagram that fills that extra byte was larger than the
 * configured size (the kernel truncated the remainder) and is dropped whole.
 *
 * <h2>Housekeeping</h2>
 * Each start schedules periodic rate-limiter sweeps that stop when the start's
 * cancellation signal fires.
 */
public final class UdpListener implements AutoCloseable
{
    public static final String PROTOCOL = "udp";
    public static final int DEFAULT_BUFFER_SIZE = 1500;

    private final ListenerContext context;
    private final RateLimiter rateLimiter;
    private final MonotonicScheduler sweepScheduler;
    private final Duration sweepInterval;
    private final ServerLifecycle lifecycle;

    /**
     * Binds the UDP socket immediately.
     *
     * @throws com.questrail.hamgateway.server.ServerBindException if the socket cannot be bound
     */
    public UdpListener(ServerConfig config,
                       ListenerContext context,
                       RateLimiter rateLimiter,
                       MonotonicScheduler sweepScheduler)
    {
        this(config, context, rateLimiter, sweepScheduler, RateLimiter.DEFAULT_SWEEP_INTERVAL);
    }

    public UdpListener(ServerConfig config,
                       ListenerContext context,
                       RateLimiter rateLimiter,
                       MonotonicScheduler sweepScheduler,
                       Duration sweepInterval)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.sweepScheduler = Objects.requireNonNull(sweepScheduler, "sweepScheduler");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");

        // The pipeline first reads lifecycle after start() enables reads.
        this.lifecycle = new ServerLifecycle(new UdpTransport(), config, context);
    }

    public void start()
    {
        lifecycle.start();
    }

    public void start(CancellationSignal cancellation)
    {
        lifecycle.start(cancellation);
    }

    public void stop()
    {
        lifecycle.stop();
    }

    @Override
    public void close()
    {
        lifecycle.close();
    }

    public boolean isRunning()
    {
        return lifecycle.isRunning();
    }

    public LifecycleState state()
    {
        return lifecycle.state();
    }

    public InetSocketAddress localAddress()
    {
        return lifecycle.localAddress();
    }

    public int bufferSize()
    {
        return lifecycle.bufferSize();
    }

    private void reject(InetSocketAddress remote, SourceRejectedEvent.Reason reason, String detail)
    {
        context.sink().onSourceRejected(new SourceRejectedEvent(
            context.wallClock().now(), PROTOCOL, remote, reason, detail));
    }

    /**
     * UdpTransport
     * -------------------------------------------------------------------------
     * Datagram channel bootstrap plus the rate-limiter sweep schedule.
     */
    private final class UdpTransport implements ListenerTransport
    {
        @Override
        public String protocol()
        {
            return PROTOCOL;
        }

        @Override
        public int defaultBufferSize()
        {
            return DEFAULT_BUFFER_SIZE;
        }

        @Override
        public ChannelFuture bind(EventLoopGroup group, ServerConfig config, int bufferSize)
        {
            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(group)
                    .channel(NioDatagramChannel.class)
                    .option(ChannelOption.SO_BROADCAST, false)
                    .option(ChannelOption.SO_REUSEADDR, config.reuseAddress())
                    .option(ChannelOption.AUTO_READ, false)
                    .option(ChannelOption.ALLOCATOR, context.bufferPool().allocator())
                    .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(bufferSize + 1))
                    .handler(new ChannelInitializer<NioDatagramChannel>() {
                        @Override
                        protected void initChannel(NioDatagramChannel ch)
                        {
                            ch.pipeline().addLast(new DatagramHandler(bufferSize));
                        }
                    });

            return bootstrap.bind(config.bindAddress());
        }

        @Override
        public void onStart(Channel channel, CancellationSignal cancellation)
        {
            Cancellable sweeps = rateLimiter.scheduleSweeps(sweepScheduler, sweepInterval);
            cancellation.onCancel(sweeps::cancel);
        }
    }

    /**
     * DatagramHandler
     * -------------------------------------------------------------------------
     * Applies the gating checks and hands accepted payloads to processing.
     * Netty releases each packet after {@link #channelRead0} returns.
     */
    private final class DatagramHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final int bufferSize;

        private DatagramHandler(int bufferSize)
        {
            this.bufferSize = bufferSize;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            InetSocketAddress sender = packet.sender();
            if (sender == null || sender.getAddress() == null) {
                reject(sender, SourceRejectedEvent.Reason.NO_ENDPOINT, "datagram without a resolvable sender");
                return;
            }

            Optional<String> label = context.blacklist().match(sender.getAddress());
            if (label.isPresent()) {
                reject(sender, SourceRejectedEvent.Reason.BLACKLISTED, label.get());
                return;
            }

            if (!rateLimiter.allowRequest(sender.getAddress())) {
                reject(sender, SourceRejectedEvent.Reason.RATE_LIMITED,
                    "more than " + rateLimiter.maxRequests() + " datagrams per window");
                return;
            }

            ByteBuf content = packet.content();
            int length = content.readableBytes();
            if (length == 0) {
                reject(sender, SourceRejectedEvent.Reason.EMPTY_PAYLOAD, null);
                return;
            }
            if (length > bufferSize) {
                reject(sender, SourceRejectedEvent.Reason.OVERSIZED_PAYLOAD,
                    "datagram exceeds " + bufferSize + " bytes");
                return;
            }

            OwnedBuffer payload = context.bufferPool().copyOf(content);
            lifecycle.dispatch(payload, sender);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Socket faults are reported; the channel stays open and keeps receiving.
            context.sink().onError(new GatewayErrorEvent(
                context.wallClock().now(), "UDP receive fault on " + ctx.channel().localAddress(), cause));
        }
    }
}
