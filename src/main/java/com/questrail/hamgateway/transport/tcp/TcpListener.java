package com.questrail.hamgateway.transport.tcp;

import com.questrail.hamgateway.buffer.OwnedBuffer;
import com.questrail.hamgateway.config.ServerConfig;
import com.questrail.hamgateway.observability.GatewayErrorEvent;
import com.questrail.hamgateway.observability.SourceRejectedEvent;
import com.questrail.hamgateway.observability.TransportObservabilityEvent;
import com.questrail.hamgateway.server.CancellationSignal;
import com.questrail.hamgateway.server.LifecycleState;
import com.questrail.hamgateway.server.ListenerContext;
import com.questrail.hamgateway.server.ListenerTransport;
import com.questrail.hamgateway.server.ServerLifecycle;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * TcpListener
 * =============================================================================
 * Accepts TCP connections and reads one unframed message per connection.
 *
 * <h2>Read sequence</h2>
 * Each accepted connection gets one rented buffer of the configured size. Bytes
 * are appended until one of:
 * <ul>
 *   <li>the peer closes the stream: the bytes read are forwarded</li>
 *   <li>the buffer is full: a truncation warning is reported, the bytes read
 *       are forwarded and the connection is closed</li>
 *   <li>the read timeout elapses: a warning is reported, the bytes read are
 *       forwarded and the connection is closed</li>
 *   <li>a socket fault: it is reported and nothing is forwarded</li>
 * </ul>
 * A sequence that read nothing is reported as an empty payload. Multiple
 * messages on one connection are not split, and a message larger than the
 * buffer is truncated; there is no framing on this wire.
 *
 * <h2>Gating</h2>
 * Connections without a resolvable remote address, or from a blacklisted
 * address, are reported and closed before anything is read. TCP connections
 * are not rate limited.
 *
 * <h2>Cancellation</h2>
 * Cancelling the server's signal stops accepting and closes every open
 * connection. Partial reads of closed connections are dropped.
 */
public final class TcpListener implements AutoCloseable
{
    public static final String PROTOCOL = "tcp";
    public static final int DEFAULT_BUFFER_SIZE = 16384;

    private final ListenerContext context;
    private final ChannelGroup connections = new DefaultChannelGroup("tcp-connections", GlobalEventExecutor.INSTANCE);
    private final ServerLifecycle lifecycle;

    /**
     * Binds the TCP server socket immediately.
     *
     * @throws com.questrail.hamgateway.server.ServerBindException if the socket cannot be bound
     */
    public TcpListener(ServerConfig config, ListenerContext context)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.lifecycle = new ServerLifecycle(new TcpTransport(), config, context);
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

    /**
     * Number of connections currently open.
     */
    public int openConnections()
    {
        return connections.size();
    }

    private void reject(SocketAddress remote, SourceRejectedEvent.Reason reason, String detail)
    {
        context.sink().onSourceRejected(new SourceRejectedEvent(
            context.wallClock().now(), PROTOCOL, remote, reason, detail));
    }

    private void warn(TransportObservabilityEvent.Kind kind, SocketAddress remote, String detail)
    {
        context.sink().onTransportEvent(new TransportObservabilityEvent(
            context.wallClock().now(), PROTOCOL, kind, remote, detail));
    }

    /**
     * TcpTransport
     * -------------------------------------------------------------------------
     * Server bootstrap; accepted channels share the lifecycle's event loops.
     */
    private final class TcpTransport implements ListenerTransport
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
        public int ioThreads()
        {
            return 2;
        }

        @Override
        public ChannelFuture bind(EventLoopGroup group, ServerConfig config, int bufferSize)
        {
            long readTimeoutMillis = config.readTimeout().toMillis();

            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(group)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, config.reuseAddress())
                    .option(ChannelOption.AUTO_READ, false)
                    .childOption(ChannelOption.ALLOCATOR, context.bufferPool().allocator())
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch)
                        {
                            ch.pipeline()
                                .addLast(new ReadTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS))
                                .addLast(new ConnectionHandler(bufferSize));
                        }
                    });

            return bootstrap.bind(config.bindAddress());
        }

        @Override
        public void onStart(Channel channel, CancellationSignal cancellation)
        {
            cancellation.onCancel(connections::close);
        }
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One read sequence per connection. All callbacks run on the connection's
     * event loop, so the handler's state needs no synchronization.
     */
    private final class ConnectionHandler extends ChannelInboundHandlerAdapter
    {
        private final int bufferSize;

        private InetSocketAddress remote;
        private OwnedBuffer buffer;

        private ConnectionHandler(int bufferSize)
        {
            this.bufferSize = bufferSize;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            SocketAddress address = ctx.channel().remoteAddress();
            if (!(address instanceof InetSocketAddress) || ((InetSocketAddress) address).getAddress() == null) {
                reject(address, SourceRejectedEvent.Reason.NO_ENDPOINT, "connection without a resolvable remote address");
                ctx.close();
                return;
            }

            remote = (InetSocketAddress) address;
            Optional<String> label = context.blacklist().match(remote.getAddress());
            if (label.isPresent()) {
                reject(remote, SourceRejectedEvent.Reason.BLACKLISTED, label.get());
                ctx.close();
                return;
            }

            connections.add(ctx.channel());
            buffer = context.bufferPool().rent(bufferSize);
            ctx.fireChannelActive();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            try {
                if (buffer == null) {
                    return;
                }

                buffer.append((ByteBuf) msg);
                if (buffer.isFull()) {
                    warn(TransportObservabilityEvent.Kind.PAYLOAD_TRUNCATED, remote,
                        "payload filled the " + bufferSize + " byte buffer");
                    forward();
                    ctx.close();
                }
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            forward();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof ReadTimeoutException) {
                if (buffer != null) {
                    warn(TransportObservabilityEvent.Kind.READ_TIMED_OUT, remote,
                        "read " + buffer.length() + " bytes before the timeout");
                }
                forward();
            } else {
                discard();
                context.sink().onError(new GatewayErrorEvent(
                    context.wallClock().now(), "TCP connection fault from " + remote, cause));
            }
            ctx.close();
        }

        @Override
        public void handlerRemoved(ChannelHandlerContext ctx)
        {
            discard();
        }

        /**
         * Ends the read sequence, handing whatever was read to processing.
         */
        private void forward()
        {
            OwnedBuffer data = buffer;
            if (data == null) {
                return;
            }
            buffer = null;

            try (data) {
                if (data.length() > 0) {
                    lifecycle.dispatch(context.bufferPool().copyOf(data), remote);
                } else {
                    reject(remote, SourceRejectedEvent.Reason.EMPTY_PAYLOAD, "connection closed without data");
                }
            }
        }

        private void discard()
        {
            OwnedBuffer data = buffer;
            if (data != null) {
                buffer = null;
                data.close();
            }
        }
    }
}
