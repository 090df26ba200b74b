package com.questrail.hamgateway.server;

import com.questrail.hamgateway.internal.time.Cancellable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void callbacksRunOnceOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        signal.onCancel(runs::incrementAndGet);

        assertFalse(signal.isCancelled());
        signal.cancel();
        signal.cancel();

        assertTrue(signal.isCancelled());
        assertEquals(1, runs.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = signal.onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertFalse(registration.cancel(), "registration already fired");
    }

    @Test
    void cancelledRegistrationDoesNotRun() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = signal.onCancel(runs::incrementAndGet);

        assertTrue(registration.cancel());
        assertFalse(registration.cancel());
        signal.cancel();

        assertEquals(0, runs.get());
    }

    @Test
    void callbacksRunInRegistrationOrder() {
        CancellationSignal signal = new CancellationSignal();
        List<String> order = new ArrayList<>();
        signal.onCancel(() -> order.add("first"));
        signal.onCancel(() -> order.add("second"));

        signal.cancel();

        assertEquals(List.of("first", "second"), order);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        IllegalStateException first = new IllegalStateException("first");
        IllegalArgumentException second = new IllegalArgumentException("second");

        signal.onCancel(() -> { throw first; });
        signal.onCancel(runs::incrementAndGet);
        signal.onCancel(() -> { throw second; });

        IllegalStateException thrown = assertThrows(IllegalStateException.class, signal::cancel);

        assertSame(first, thrown);
        assertEquals(1, runs.get());
        assertEquals(1, thrown.getSuppressed().length);
        assertSame(second, thrown.getSuppressed()[0]);
        assertTrue(signal.isCancelled());
    }
}
