package com.questrail.hamgateway.server;

import com.questrail.hamgateway.internal.time.Cancellable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CancellationSignal
 * =============================================================================
 * One-shot cancellation flag shared by a server's receive loop, its in-flight
 * message processing and its background housekeeping.
 *
 * <p>{@link #cancel()} is idempotent. Callbacks registered with
 * {@link #onCancel(Runnable)} run exactly once: on the thread that cancels, or
 * immediately on the registering thread if the signal is already cancelled.</p>
 */
public final class CancellationSignal
{
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public boolean isCancelled()
    {
        return cancelled.get();
    }

    /**
     * Cancels the signal and runs every registered callback.
     *
     * <p>All callbacks run even if one fails; the first failure is rethrown
     * afterwards with later failures attached as suppressed.</p>
     */
    public void cancel()
    {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }

        RuntimeException failure = null;
        for (Registration r : registrations) {
            try {
                r.fire();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Registers a callback to run on cancellation.
     *
     * @return handle that unregisters the callback if it has not run yet
     */
    public Cancellable onCancel(Runnable callback)
    {
        Registration r = new Registration(Objects.requireNonNull(callback, "callback"));
        registrations.add(r);
        if (cancelled.get()) {
            r.fire();
        }
        return r;
    }

    private final class Registration implements Cancellable
    {
        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Registration(Runnable callback)
        {
            this.callback = callback;
        }

        void fire()
        {
            if (done.compareAndSet(false, true)) {
                registrations.remove(this);
                callback.run();
            }
        }

        @Override
        public boolean cancel()
        {
            if (done.compareAndSet(false, true)) {
                registrations.remove(this);
                return true;
            }
            return false;
        }
    }
}
