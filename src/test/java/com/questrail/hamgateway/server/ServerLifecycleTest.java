package com.questrail.hamgateway.server;

import com.questrail.hamgateway.config.ServerConfig;
import com.questrail.hamgateway.observability.RecordingObservabilitySink;
import com.questrail.hamgateway.observability.TransportObservabilityEvent;
import com.questrail.hamgateway.testing.FreePorts;
import com.questrail.hamgateway.testing.TestListenerContexts;
import com.questrail.hamgateway.transport.tcp.TcpListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the shared state machine through the TCP listener, which is the
 * simplest transport to drive from a plain socket client.
 */
class ServerLifecycleTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private CountDownLatch delivered;
    private TcpListener listener;
    private int port;

    @BeforeEach
    void bind() {
        delivered = new CountDownLatch(1);
        port = FreePorts.tcp();
        listener = new TcpListener(config(port), TestListenerContexts.inline((payload, sender, cancellation) -> {
            received.add(payload.toString(StandardCharsets.UTF_8));
            delivered.countDown();
        }, sink));
    }

    @AfterEach
    void dispose() {
        listener.close();
    }

    @Test
    void bindingReportsBoundAndStaysStopped() {
        assertEquals(LifecycleState.STOPPED, listener.state());
        assertFalse(listener.isRunning());
        assertEquals(port, listener.localAddress().getPort());
        assertEquals(1, sink.transportEvents(TransportObservabilityEvent.Kind.BOUND).size());
    }

    @Test
    void startAndStopTransitionRunningState() {
        listener.start();
        assertTrue(listener.isRunning());
        assertEquals(LifecycleState.RUNNING, listener.state());

        listener.stop();
        assertFalse(listener.isRunning());
        assertEquals(LifecycleState.STOPPED, listener.state());

        assertEquals(1, sink.transportEvents(TransportObservabilityEvent.Kind.STARTED).size());
        List<TransportObservabilityEvent> stopped = sink.transportEvents(TransportObservabilityEvent.Kind.STOPPED);
        assertEquals(1, stopped.size());
        assertNull(stopped.get(0).detail(), "receive loop should confirm exit in time");
    }

    @Test
    void startWhileRunningIsRejected() {
        listener.start();

        assertThrows(IllegalStateException.class, listener::start);
        assertTrue(listener.isRunning());
    }

    @Test
    void stopWhileStoppedIsRejected() {
        assertThrows(IllegalStateException.class, listener::stop);

        listener.start();
        listener.stop();
        assertThrows(IllegalStateException.class, listener::stop);
    }

    @Test
    void closeIsIdempotentAndFinal() {
        listener.start();

        listener.close();
        listener.close();
        listener.close();

        assertEquals(LifecycleState.DISPOSED, listener.state());
        assertFalse(listener.isRunning());
        assertThrows(IllegalStateException.class, listener::start);
        assertThrows(IllegalStateException.class, listener::stop);
        assertEquals(1, sink.transportEvents(TransportObservabilityEvent.Kind.DISPOSED).size());
    }

    @Test
    void closeReleasesThePort() {
        listener.close();

        try (TcpListener rebound = new TcpListener(config(port),
                TestListenerContexts.inline((payload, sender, cancellation) -> { }, sink))) {
            assertEquals(port, rebound.localAddress().getPort());
        }
    }

    @Test
    void listenerCanBeRestartedAfterStop() throws Exception {
        listener.start();
        listener.stop();
        listener.start();

        send("<AppInfo/>");

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("<AppInfo/>"), received);
    }

    @Test
    void externalCancellationEndsReceivingButNotTheRunningState() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        listener.start(signal);

        signal.cancel();

        assertTrue(listener.isRunning(), "stop() is still required");
        listener.stop();
        assertEquals(LifecycleState.STOPPED, listener.state());
    }

    @Test
    void startWithAlreadyCancelledSignalCanStillBeStopped() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        listener.start(signal);
        listener.stop();

        assertNull(sink.transportEvents(TransportObservabilityEvent.Kind.STOPPED).get(0).detail());
    }

    @Test
    void bindingAnOccupiedPortFails() {
        ServerBindException e = assertThrows(ServerBindException.class, () ->
            new TcpListener(ServerConfig.builder()
                    .withAddress(FreePorts.LOOPBACK)
                    .withPort(port)
                    .withReuseAddress(false)
                    .build(),
                TestListenerContexts.inline((payload, sender, cancellation) -> { }, sink)));

        assertEquals(port, ((InetSocketAddress) e.address()).getPort());
        assertNotNull(e.getCause());
        assertEquals(LifecycleState.STOPPED, listener.state(), "first listener is unaffected");
    }

    private void send(String payload) throws IOException {
        try (Socket socket = new Socket(FreePorts.LOOPBACK, port)) {
            OutputStream out = socket.getOutputStream();
            out.write(payload.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }

    private static ServerConfig config(int port) {
        return ServerConfig.builder()
            .withAddress(FreePorts.LOOPBACK)
            .withPort(port)
            .build();
    }
}
