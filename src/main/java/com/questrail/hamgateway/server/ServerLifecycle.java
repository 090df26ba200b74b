package com.questrail.hamgateway.server;

import com.questrail.hamgateway.buffer.OwnedBuffer;
import com.questrail.hamgateway.config.ServerConfig;
import com.questrail.hamgateway.observability.GatewayErrorEvent;
import com.questrail.hamgateway.observability.MessageDroppedEvent;
import com.questrail.hamgateway.observability.TransportObservabilityEvent;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * ServerLifecycle
 * =============================================================================
 * Shared start/stop/dispose state machine for a single bound listener socket.
 *
 * <h2>Architectural Role</h2>
 * The protocol-specific receive loop is supplied as a {@link ListenerTransport}
 * strategy. This class owns everything the protocols have in common:
 * <ul>
 *   <li>the event loop group and the bound channel</li>
 *   <li>the {@link LifecycleState} transitions and their misuse checks</li>
 *   <li>the per-start {@link CancellationSignal}</li>
 *   <li>the hand-off of received payloads to message processing</li>
 * </ul>
 *
 * <h2>Receive loop</h2>
 * The socket is bound during construction with {@code AUTO_READ} disabled, so
 * an unusable address fails here and not at {@link #start()}. Starting enables
 * reads; cancelling the signal disables them on the channel's event loop and
 * completes the loop's completion promise, which {@link #stop()} awaits for at
 * most {@link #STOP_TIMEOUT}.
 *
 * <p>Cancelling the signal externally ends the receive loop but leaves the
 * state {@code RUNNING}; {@link #stop()} is still required to return to
 * {@code STOPPED}.</p>
 *
 * <h2>Disposal</h2>
 * {@link #close()} is idempotent, valid in every state, and never throws.
 * Faults while releasing the socket or the event loop are reported to the
 * observability sink.
 */
public final class ServerLifecycle implements AutoCloseable
{
    public static final Duration STOP_TIMEOUT = Duration.ofSeconds(1);

    private final ListenerTransport transport;
    private final ListenerContext context;
    private final int bufferSize;

    private final EventLoopGroup group;
    private final Channel channel;

    private final Object lock = new Object();

    // Guarded by lock; volatile for lock-free reads from I/O threads.
    private volatile LifecycleState state = LifecycleState.STOPPED;
    private volatile CancellationSignal cancellation;
    private Promise<Void> loopDone;

    /**
     * Binds the transport's socket immediately.
     *
     * @throws ServerBindException if the socket cannot be bound
     */
    public ServerLifecycle(ListenerTransport transport, ServerConfig config, ListenerContext context)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.context = Objects.requireNonNull(context, "context");
        Objects.requireNonNull(config, "config");

        this.bufferSize = config.bufferSizeOr(transport.defaultBufferSize());
        this.group = new NioEventLoopGroup(transport.ioThreads());

        ChannelFuture bound;
        try {
            bound = transport.bind(group, config, bufferSize).awaitUninterruptibly();
        } catch (RuntimeException e) {
            group.shutdownGracefully(0, STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            throw new ServerBindException(transport.protocol(), config.bindAddress(), e);
        }

        if (!bound.isSuccess()) {
            group.shutdownGracefully(0, STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            throw new ServerBindException(transport.protocol(), config.bindAddress(), bound.cause());
        }

        this.channel = bound.channel();
        transportEvent(TransportObservabilityEvent.Kind.BOUND, channel.localAddress(), null);
    }

    public void start()
    {
        start(null);
    }

    /**
     * Starts receiving.
     *
     * @param external cancellation signal to bind the receive loop to, or
     *                 {@code null} to create a new one
     * @throws IllegalStateException if running or disposed
     * @throws RuntimeException whatever the transport's start hook throws; the
     *         listener then stays {@code STOPPED}
     */
    public void start(CancellationSignal external)
    {
        synchronized (lock) {
            requireNotDisposed();
            if (state == LifecycleState.RUNNING) {
                throw new IllegalStateException(transport.protocol() + " listener is already running");
            }

            CancellationSignal signal = external != null ? external : new CancellationSignal();
            Promise<Void> done = channel.eventLoop().newPromise();

            transport.onStart(channel, signal);

            cancellation = signal;
            loopDone = done;
            state = LifecycleState.RUNNING;
            channel.config().setAutoRead(true);

            // Registered after enabling reads so an already-cancelled signal
            // turns them straight back off.
            signal.onCancel(() -> endReceiveLoop(done));
        }

        transportEvent(TransportObservabilityEvent.Kind.STARTED, channel.localAddress(), null);
    }

    /**
     * Cancels the receive loop and waits up to {@link #STOP_TIMEOUT} for it to
     * end.
     *
     * @throws IllegalStateException if not running
     */
    public void stop()
    {
        String detail = null;

        synchronized (lock) {
            requireNotDisposed();
            if (state != LifecycleState.RUNNING) {
                throw new IllegalStateException(transport.protocol() + " listener is not running");
            }

            cancelQuietly(cancellation);

            if (!loopDone.awaitUninterruptibly(STOP_TIMEOUT.toMillis())) {
                detail = "receive loop did not confirm exit within " + STOP_TIMEOUT.toMillis() + " ms";
            }

            loopDone = null;
            state = LifecycleState.STOPPED;
        }

        transportEvent(TransportObservabilityEvent.Kind.STOPPED, channel.localAddress(), detail);
    }

    @Override
    public void close()
    {
        CancellationSignal signal;

        synchronized (lock) {
            if (state == LifecycleState.DISPOSED) {
                return;
            }
            signal = state == LifecycleState.RUNNING ? cancellation : null;
            state = LifecycleState.DISPOSED;
            loopDone = null;
        }

        cancelQuietly(signal);

        ChannelFuture closed = channel.close().awaitUninterruptibly();
        if (!closed.isSuccess()) {
            error("Failed to close " + transport.protocol() + " channel", closed.cause());
        }

        Future<?> shutdown = group.shutdownGracefully(0, STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (!shutdown.awaitUninterruptibly(STOP_TIMEOUT.toMillis() * 2)) {
            error("Event loop of " + transport.protocol() + " listener did not terminate", null);
        } else if (!shutdown.isSuccess()) {
            error("Failed to shut down event loop of " + transport.protocol() + " listener", shutdown.cause());
        }

        transportEvent(TransportObservabilityEvent.Kind.DISPOSED, channel.localAddress(), null);
    }

    /**
     * Hands a received payload to message processing without blocking the
     * calling I/O thread.
     *
     * <p>Ownership of {@code payload} transfers to this method. It is released
     * after processing, or immediately if the listener was never started or
     * the processing executor refuses it. A payload accepted before a stop is
     * still processed; the handler sees the cancelled signal.</p>
     */
    public void dispatch(OwnedBuffer payload, InetSocketAddress sender)
    {
        CancellationSignal signal = cancellation;
        if (signal == null) {
            payload.close();
            context.sink().onMessageDropped(new MessageDroppedEvent(
                context.wallClock().now(), sender, MessageDroppedEvent.Reason.NOT_STARTED,
                null, transport.protocol() + " listener was never started"));
            return;
        }

        try {
            context.processingExecutor().execute(() -> process(payload, sender, signal));
        } catch (RejectedExecutionException e) {
            payload.close();
            error("Processing executor rejected message from " + sender, e);
        }
    }

    public boolean isRunning()
    {
        return state == LifecycleState.RUNNING;
    }

    public LifecycleState state()
    {
        return state;
    }

    public InetSocketAddress localAddress()
    {
        return (InetSocketAddress) channel.localAddress();
    }

    public int bufferSize()
    {
        return bufferSize;
    }

    public String protocol()
    {
        return transport.protocol();
    }

    public ListenerContext context()
    {
        return context;
    }

    // -------------------------------------------------------------------------
    // Internal helpers
    // -------------------------------------------------------------------------

    private void process(OwnedBuffer payload, InetSocketAddress sender, CancellationSignal signal)
    {
        try (payload) {
            context.processor().process(payload, sender, signal);
        } catch (RuntimeException e) {
            error("Message processing failed for payload from " + sender, e);
        }
    }

    private void endReceiveLoop(Promise<Void> done)
    {
        try {
            channel.eventLoop().execute(() -> {
                channel.config().setAutoRead(false);
                done.trySuccess(null);
            });
        } catch (RejectedExecutionException e) {
            // Event loop already terminated: there is no loop left to end.
            done.trySuccess(null);
        }
    }

    private void cancelQuietly(CancellationSignal signal)
    {
        if (signal == null) {
            return;
        }
        try {
            signal.cancel();
        } catch (RuntimeException e) {
            error("Cancellation callback failed for " + transport.protocol() + " listener", e);
        }
    }

    private void requireNotDisposed()
    {
        if (state == LifecycleState.DISPOSED) {
            throw new IllegalStateException(transport.protocol() + " listener has been disposed");
        }
    }

    private void transportEvent(TransportObservabilityEvent.Kind kind, SocketAddress address, String detail)
    {
        context.sink().onTransportEvent(new TransportObservabilityEvent(
            context.wallClock().now(), transport.protocol(), kind, address, detail));
    }

    private void error(String message, Throwable cause)
    {
        context.sink().onError(new GatewayErrorEvent(context.wallClock().now(), message, cause));
    }
}
