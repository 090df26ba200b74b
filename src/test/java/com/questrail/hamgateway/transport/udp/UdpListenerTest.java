package com.questrail.hamgateway.transport.udp;

import com.questrail.hamgateway.buffer.OwnedBuffer;
import com.questrail.hamgateway.config.ServerConfig;
import com.questrail.hamgateway.guard.Blacklist;
import com.questrail.hamgateway.guard.RateLimiter;
import com.questrail.hamgateway.internal.time.SystemMonotonicClock;
import com.questrail.hamgateway.message.MessageProcessor;
import com.questrail.hamgateway.observability.GatewayErrorEvent;
import com.questrail.hamgateway.observability.MessageDroppedEvent;
import com.questrail.hamgateway.observability.RecordingObservabilitySink;
import com.questrail.hamgateway.observability.SourceRejectedEvent;
import com.questrail.hamgateway.protocol.n1mm.N1mmMessageRouter;
import com.questrail.hamgateway.protocol.n1mm.schema.AppInfo;
import com.questrail.hamgateway.server.ListenerContext;
import com.questrail.hamgateway.server.ServerBindException;
import com.questrail.hamgateway.testing.CapturingMessageProcessor;
import com.questrail.hamgateway.testing.DeterministicScheduler;
import com.questrail.hamgateway.testing.FreePorts;
import com.questrail.hamgateway.testing.ManualMonotonicClock;
import com.questrail.hamgateway.testing.N1mmPayloads;
import com.questrail.hamgateway.testing.RecordingN1mmMessageHandler;
import com.questrail.hamgateway.testing.TestListenerContexts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UdpListenerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualMonotonicClock sweepClock = new ManualMonotonicClock();
    private final DeterministicScheduler sweepScheduler = new DeterministicScheduler(sweepClock);

    private UdpListener listener;
    private DatagramSocket client;
    private ExecutorService processing;

    @AfterEach
    void cleanUp() {
        if (client != null) {
            client.close();
        }
        if (listener != null) {
            listener.close();
        }
        if (processing != null) {
            processing.shutdownNow();
        }
    }

    @Test
    void validDatagramReachesHandlerOnceWithSenderEndpoint() throws Exception {
        RecordingN1mmMessageHandler handler = new RecordingN1mmMessageHandler();
        listen(config().build(), N1mmMessageRouter.builder(handler).withObservabilitySink(sink).build(),
            Blacklist.withDefaults(), 60);

        send(N1mmPayloads.load("appinfo"));

        List<RecordingN1mmMessageHandler.Call> calls = handler.awaitCalls(1, WAIT);
        assertEquals(1, calls.size());
        assertEquals("appInfo", calls.get(0).operation());
        assertEquals("CWOPS", ((AppInfo) calls.get(0).message()).getContestName());
        assertEquals(client.getLocalPort(), calls.get(0).sender().getPort());
        assertEquals(InetAddress.getByName(FreePorts.LOOPBACK), calls.get(0).sender().getAddress());
    }

    @Test
    void datagramsBeyondRateLimitAreRejected() throws Exception {
        CapturingMessageProcessor processor = new CapturingMessageProcessor();
        listen(config().build(), processor, Blacklist.empty(), 60);

        for (int i = 0; i < 61; i++) {
            send(("<appinfo><contestnr>" + i + "</contestnr></appinfo>").getBytes(StandardCharsets.UTF_8));
        }

        Optional<SourceRejectedEvent> limited = sink.awaitEvent(SourceRejectedEvent.class,
            e -> e.reason() == SourceRejectedEvent.Reason.RATE_LIMITED, WAIT);
        assertTrue(limited.isPresent());

        for (int i = 0; i < 60; i++) {
            assertNotNull(processor.next(WAIT), "datagram " + i + " should be processed");
        }
        assertNull(processor.next(Duration.ofMillis(200)));
        assertEquals(1, sink.rejections(SourceRejectedEvent.Reason.RATE_LIMITED).size());
    }

    @Test
    void slowAndFailingProcessingDoNotStallTheReceiveLoop() throws Exception {
        CountDownLatch unblock = new CountDownLatch(1);
        List<OwnedBuffer> handedOver = new CopyOnWriteArrayList<>();
        BlockingQueue<String> completed = new LinkedBlockingQueue<>();
        IllegalStateException failure = new IllegalStateException("handler crashed");

        processing = Executors.newFixedThreadPool(2);
        listen(config().build(), TestListenerContexts.onExecutor(processing, (payload, sender, cancellation) -> {
            handedOver.add(payload);
            String text = payload.toString(StandardCharsets.UTF_8);
            if (text.equals("<slow/>")) {
                try {
                    unblock.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            } else if (text.equals("<fail/>")) {
                throw failure;
            }
            completed.add(text);
        }, sink), 60);

        send("<slow/>".getBytes(StandardCharsets.UTF_8));
        send("<fail/>".getBytes(StandardCharsets.UTF_8));
        send("<after/>".getBytes(StandardCharsets.UTF_8));

        assertEquals("<after/>", completed.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS),
            "datagram after a blocked and a failed one is still processed");
        assertEquals(1, unblock.getCount(), "first payload is still being processed");

        Optional<GatewayErrorEvent> error = sink.awaitEvent(GatewayErrorEvent.class,
            e -> e.cause() == failure, WAIT);
        assertTrue(error.isPresent());

        unblock.countDown();
        assertEquals("<slow/>", completed.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS));

        processing.shutdown();
        assertTrue(processing.awaitTermination(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertEquals(3, handedOver.size());
        handedOver.forEach(b -> assertTrue(b.isReleased(), "buffer released after processing"));
        assertEquals(1, sink.errors().size());
        assertTrue(listener.isRunning());
    }

    @Test
    void datagramHandedOffBeforeStopIsStillDelivered() throws Exception {
        BlockingQueue<Runnable> deferred = new LinkedBlockingQueue<>();
        RecordingN1mmMessageHandler handler = new RecordingN1mmMessageHandler();
        listen(config().build(), TestListenerContexts.onExecutor(deferred::add,
            N1mmMessageRouter.builder(handler).withObservabilitySink(sink).build(), sink), 60);

        send(N1mmPayloads.load("appinfo"));
        Runnable processingTask = deferred.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertNotNull(processingTask);

        listener.stop();
        processingTask.run();

        List<RecordingN1mmMessageHandler.Call> calls = handler.calls("appInfo");
        assertEquals(1, calls.size());
        assertTrue(calls.get(0).cancellation().isCancelled());
        assertTrue(sink.eventsOfType(MessageDroppedEvent.class).isEmpty());
    }

    @Test
    void blacklistedSenderIsRejected() throws Exception {
        CapturingMessageProcessor processor = new CapturingMessageProcessor();
        listen(config().build(), processor, Blacklist.empty().add("loopback", List.of("127.0.0.0/8")), 60);

        send(N1mmPayloads.load("appinfo"));

        Optional<SourceRejectedEvent> rejected = sink.awaitEvent(SourceRejectedEvent.class,
            e -> e.reason() == SourceRejectedEvent.Reason.BLACKLISTED, WAIT);
        assertTrue(rejected.isPresent());
        assertEquals("loopback", rejected.get().detail());
        assertNull(processor.next(Duration.ofMillis(200)));
    }

    @Test
    void datagramsLargerThanBufferAreRejected() throws Exception {
        CapturingMessageProcessor processor = new CapturingMessageProcessor();
        listen(config().withBufferSize(64).build(), processor, Blacklist.empty(), 60);

        String exact = pad("<appinfo/>", 64);
        send(pad("<appinfo/>", 65).getBytes(StandardCharsets.UTF_8));
        send(exact.getBytes(StandardCharsets.UTF_8));

        CapturingMessageProcessor.Received received = processor.next(WAIT);
        assertNotNull(received);
        assertEquals(exact, received.payload());

        assertEquals(1, sink.rejections(SourceRejectedEvent.Reason.OVERSIZED_PAYLOAD).size());
        assertNull(processor.next(Duration.ofMillis(200)));
    }

    @Test
    void emptyDatagramIsRejected() throws Exception {
        CapturingMessageProcessor processor = new CapturingMessageProcessor();
        listen(config().build(), processor, Blacklist.empty(), 60);

        send(new byte[0]);

        assertTrue(sink.awaitEvent(SourceRejectedEvent.class,
            e -> e.reason() == SourceRejectedEvent.Reason.EMPTY_PAYLOAD, WAIT).isPresent());
        assertEquals(0, processor.count());
    }

    @Test
    void configuredBufferSizeDefaultsToProtocolDefault() throws Exception {
        listen(config().build(), new CapturingMessageProcessor(), Blacklist.empty(), 60);

        assertEquals(UdpListener.DEFAULT_BUFFER_SIZE, listener.bufferSize());
    }

    @Test
    void sweepsRunOnlyWhileStarted() throws Exception {
        listen(config().build(), new CapturingMessageProcessor(), Blacklist.empty(), 60);
        listener.stop();
        assertEquals(0, sweepScheduler.pendingTasks());

        listener.start();
        assertEquals(1, sweepScheduler.pendingTasks());

        listener.stop();
        assertEquals(0, sweepScheduler.pendingTasks());
    }

    @Test
    void bindingAnOccupiedPortFails() throws Exception {
        try (DatagramSocket occupant = new DatagramSocket(
                new InetSocketAddress(InetAddress.getByName(FreePorts.LOOPBACK), 0))) {
            ServerConfig config = ServerConfig.builder()
                .withAddress(FreePorts.LOOPBACK)
                .withPort(occupant.getLocalPort())
                .withReuseAddress(false)
                .build();

            assertThrows(ServerBindException.class, () -> new UdpListener(config,
                TestListenerContexts.inline(new CapturingMessageProcessor(), sink),
                RateLimiter.perMinute(60, SystemMonotonicClock.INSTANCE), sweepScheduler));
        }
    }

    private void listen(ServerConfig config,
                        MessageProcessor processor,
                        Blacklist blacklist,
                        int perMinute) throws IOException {
        listen(config, TestListenerContexts.inline(processor, blacklist, sink), perMinute);
    }

    private void listen(ServerConfig config, ListenerContext context, int perMinute) throws IOException {
        listener = new UdpListener(config,
            context,
            RateLimiter.perMinute(perMinute, SystemMonotonicClock.INSTANCE),
            sweepScheduler);
        listener.start();

        client = new DatagramSocket(new InetSocketAddress(InetAddress.getByName(FreePorts.LOOPBACK), 0));
    }

    private void send(byte[] payload) throws IOException {
        client.send(new DatagramPacket(payload, payload.length, listener.localAddress()));
    }

    private static ServerConfig.Builder config() {
        return ServerConfig.builder()
            .withAddress(FreePorts.LOOPBACK)
            .withPort(FreePorts.udp());
    }

    private static String pad(String xml, int length) {
        return xml + " ".repeat(length - xml.length());
    }
}
