package com.questrail.hamgateway.testing;

import com.questrail.hamgateway.protocol.n1mm.N1mmMessageHandler;
import com.questrail.hamgateway.protocol.n1mm.schema.AppInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactDelete;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactReplace;
import com.questrail.hamgateway.protocol.n1mm.schema.DynamicResults;
import com.questrail.hamgateway.protocol.n1mm.schema.LookupInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.N1mmMessage;
import com.questrail.hamgateway.protocol.n1mm.schema.RadioInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.Spot;
import com.questrail.hamgateway.server.CancellationSignal;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test handler that records every delivered message.
 */
public final class RecordingN1mmMessageHandler implements N1mmMessageHandler {

    public record Call(String operation, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation) {
    }

    private final List<Call> calls = new ArrayList<>();
    private volatile RuntimeException failure;

    /**
     * Makes every subsequent operation throw {@code failure} after recording.
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public synchronized List<Call> calls() {
        return new ArrayList<>(calls);
    }

    public synchronized List<Call> calls(String operation) {
        return calls.stream()
            .filter(c -> c.operation().equals(operation))
            .collect(Collectors.toList());
    }

    /**
     * Waits until at least {@code count} calls were recorded or the timeout
     * elapses, and returns the calls recorded so far.
     */
    public synchronized List<Call> awaitCalls(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (calls.size() < count) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                break;
            }
            wait(remainingMillis);
        }
        return new ArrayList<>(calls);
    }

    @Override
    public void handleAppInfo(AppInfo message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("appInfo", message, sender, cancellation);
    }

    @Override
    public void handleContactInfo(ContactInfo message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("contactInfo", message, sender, cancellation);
    }

    @Override
    public void handleContactReplace(ContactReplace message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("contactReplace", message, sender, cancellation);
    }

    @Override
    public void handleContactDelete(ContactDelete message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("contactDelete", message, sender, cancellation);
    }

    @Override
    public void handleLookupInfo(LookupInfo message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("lookupInfo", message, sender, cancellation);
    }

    @Override
    public void handleSpot(Spot message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("spot", message, sender, cancellation);
    }

    @Override
    public void handleDynamicResults(DynamicResults message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("dynamicResults", message, sender, cancellation);
    }

    @Override
    public void handleRadioInfo(RadioInfo message, InetSocketAddress sender, CancellationSignal cancellation) {
        record("radioInfo", message, sender, cancellation);
    }

    private void record(String operation, N1mmMessage message, InetSocketAddress sender,
                        CancellationSignal cancellation) {
        synchronized (this) {
            calls.add(new Call(operation, message, sender, cancellation));
            notifyAll();
        }
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
    }
}
