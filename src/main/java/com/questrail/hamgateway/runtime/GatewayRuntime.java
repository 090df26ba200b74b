package com.questrail.hamgateway.runtime;

import com.questrail.hamgateway.buffer.BufferPool;
import com.questrail.hamgateway.config.ServerConfig;
import com.questrail.hamgateway.guard.Blacklist;
import com.questrail.hamgateway.guard.RateLimiter;
import com.questrail.hamgateway.internal.time.MonotonicClock;
import com.questrail.hamgateway.internal.time.ScheduledExecutorScheduler;
import com.questrail.hamgateway.internal.time.SystemMonotonicClock;
import com.questrail.hamgateway.internal.time.SystemWallClock;
import com.questrail.hamgateway.message.ValidatorRegistry;
import com.questrail.hamgateway.observability.GatewayErrorEvent;
import com.questrail.hamgateway.observability.GatewayObservabilitySink;
import com.questrail.hamgateway.observability.Slf4jGatewayObservabilitySink;
import com.questrail.hamgateway.protocol.n1mm.N1mmMessageHandler;
import com.questrail.hamgateway.protocol.n1mm.N1mmMessageRouter;
import com.questrail.hamgateway.protocol.n1mm.TagRegistry;
import com.questrail.hamgateway.server.ListenerContext;
import com.questrail.hamgateway.transport.tcp.TcpListener;
import com.questrail.hamgateway.transport.udp.UdpListener;

import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * GatewayRuntime
 * =============================================================================
 * Composition root and lifecycle owner for an N1MM gateway.
 *
 * <p>Builds the shared pieces once (buffer pool, blacklist, router, processing
 * executor, sweep scheduler) and one listener per configured protocol. The
 * listeners bind during {@link Builder#build()}; {@link #start()} and
 * {@link #stop()} drive all of them together.</p>
 */
public final class GatewayRuntime implements AutoCloseable {
    private final UdpListener udpListener;
    private final TcpListener tcpListener;
    private final RateLimiter rateLimiter;
    private final EventExecutorGroup processingExecutor;
    private final ScheduledExecutorService sweepExecutor;
    private final GatewayObservabilitySink observabilitySink;

    private final Object lock = new Object();
    private boolean closed;

    private GatewayRuntime(
            UdpListener udpListener,
            TcpListener tcpListener,
            RateLimiter rateLimiter,
            EventExecutorGroup processingExecutor,
            ScheduledExecutorService sweepExecutor,
            GatewayObservabilitySink observabilitySink) {
        this.udpListener = udpListener;
        this.tcpListener = tcpListener;
        this.rateLimiter = rateLimiter;
        this.processingExecutor = processingExecutor;
        this.sweepExecutor = sweepExecutor;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Starts every configured listener.
     *
     * @throws IllegalStateException if a listener is already running or the
     *                               runtime has been closed
     */
    public void start() {
        synchronized (lock) {
            requireOpen();
            if (udpListener != null) {
                udpListener.start();
            }
            if (tcpListener != null) {
                tcpListener.start();
            }
        }
    }

    /**
     * Stops every running listener.
     *
     * @throws IllegalStateException if no listener is running
     */
    public void stop() {
        synchronized (lock) {
            requireOpen();
            if (!isRunning()) {
                throw new IllegalStateException("Gateway is not running");
            }
            if (udpListener != null && udpListener.isRunning()) {
                udpListener.stop();
            }
            if (tcpListener != null && tcpListener.isRunning()) {
                tcpListener.stop();
            }
        }
    }

    /**
     * Disposes the listeners and shuts down the executors. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        if (udpListener != null) {
            udpListener.close();
        }
        if (tcpListener != null) {
            tcpListener.close();
        }
        shutdown(processingExecutor, sweepExecutor, observabilitySink);
    }

    public boolean isRunning() {
        return (udpListener != null && udpListener.isRunning())
            || (tcpListener != null && tcpListener.isRunning());
    }

    public Optional<InetSocketAddress> udpAddress() {
        return Optional.ofNullable(udpListener).map(UdpListener::localAddress);
    }

    public Optional<InetSocketAddress> tcpAddress() {
        return Optional.ofNullable(tcpListener).map(TcpListener::localAddress);
    }

    public Optional<RateLimiter> rateLimiter() {
        return Optional.ofNullable(rateLimiter);
    }

    public static Builder builder() {
        return new Builder();
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Gateway has been closed");
        }
    }

    private static void shutdown(
            EventExecutorGroup processingExecutor,
            ScheduledExecutorService sweepExecutor,
            GatewayObservabilitySink sink) {
        sweepExecutor.shutdownNow();

        Future<?> terminated = processingExecutor.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        if (!terminated.awaitUninterruptibly(10, TimeUnit.SECONDS)) {
            sink.onError(new GatewayErrorEvent(SystemWallClock.INSTANCE.now(),
                "Message processing did not finish within 10 s of shutdown", null));
        }
    }

    public static final class Builder {
        private ServerConfig udpConfig;
        private ServerConfig tcpConfig;
        private N1mmMessageHandler handler;
        private Blacklist blacklist;
        private TagRegistry tagRegistry = TagRegistry.defaults();
        private ValidatorRegistry validators = N1mmMessageRouter.defaultValidators();
        private GatewayObservabilitySink observabilitySink;
        private BufferPool bufferPool;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private int processingThreads = 4;

        public Builder withUdp(ServerConfig config) {
            this.udpConfig = config;
            return this;
        }

        public Builder withTcp(ServerConfig config) {
            this.tcpConfig = config;
            return this;
        }

        public Builder withHandler(N1mmMessageHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder withBlacklist(Blacklist blacklist) {
            this.blacklist = blacklist;
            return this;
        }

        public Builder withTagRegistry(TagRegistry tagRegistry) {
            this.tagRegistry = tagRegistry;
            return this;
        }

        public Builder withValidators(ValidatorRegistry validators) {
            this.validators = validators;
            return this;
        }

        public Builder withObservabilitySink(GatewayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withBufferPool(BufferPool bufferPool) {
            this.bufferPool = bufferPool;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withProcessingThreads(int threads) {
            this.processingThreads = threads;
            return this;
        }

        /**
         * Builds the runtime and binds its listeners.
         *
         * @throws IllegalStateException if no listener is configured
         * @throws NullPointerException if no handler is set
         * @throws com.questrail.hamgateway.server.ServerBindException if a
         *         listener cannot bind
         */
        public GatewayRuntime build() {
            if (udpConfig == null && tcpConfig == null) {
                throw new IllegalStateException("At least one of UDP or TCP must be configured");
            }
            Objects.requireNonNull(handler, "handler must be set before build()");
            Objects.requireNonNull(clock, "clock");
            if (processingThreads <= 0) {
                throw new IllegalArgumentException("processingThreads must be > 0");
            }

            GatewayObservabilitySink sink = observabilitySink != null
                ? observabilitySink
                : new Slf4jGatewayObservabilitySink();

            N1mmMessageRouter router = N1mmMessageRouter.builder(handler)
                .withTagRegistry(tagRegistry)
                .withValidators(validators)
                .withObservabilitySink(sink)
                .build();

            EventExecutorGroup processing = new DefaultEventExecutorGroup(
                processingThreads, new DefaultThreadFactory("gateway-processing", true));
            ScheduledExecutorService sweeps = Executors.newSingleThreadScheduledExecutor(
                new DefaultThreadFactory("gateway-sweeps", true));

            ListenerContext context = new ListenerContext(
                bufferPool != null ? bufferPool : new BufferPool(),
                blacklist != null ? blacklist : Blacklist.withDefaults(),
                router,
                processing,
                sink,
                SystemWallClock.INSTANCE);

            UdpListener udp = null;
            TcpListener tcp = null;
            RateLimiter limiter = null;
            try {
                if (udpConfig != null) {
                    limiter = RateLimiter.perMinute(udpConfig.requestsPerMinutePerSource(), clock);
                    udp = new UdpListener(udpConfig, context, limiter,
                        new ScheduledExecutorScheduler(sweeps, clock));
                }
                if (tcpConfig != null) {
                    tcp = new TcpListener(tcpConfig, context);
                }
            } catch (RuntimeException e) {
                if (udp != null) {
                    udp.close();
                }
                shutdown(processing, sweeps, sink);
                throw e;
            }

            return new GatewayRuntime(udp, tcp, limiter, processing, sweeps, sink);
        }
    }
}
