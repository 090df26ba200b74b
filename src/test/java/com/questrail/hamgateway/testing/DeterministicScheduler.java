package com.questrail.hamgateway.testing;

import com.questrail.hamgateway.internal.time.Cancellable;
import com.questrail.hamgateway.internal.time.MonotonicClock;
import com.questrail.hamgateway.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler driven by a {@link ManualMonotonicClock}.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called. Tasks scheduled by
 * a running task are eligible in the same call if already due.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Runs all tasks whose deadlines are <= current clock time.
     *
     * @return number of tasks run
     */
    public int runDueTasks() {
        int ran = 0;
        Scheduled next;
        while ((next = pollDue()) != null) {
            if (next.ran.compareAndSet(false, true)) {
                next.task.run();
                ran++;
            }
        }
        return ran;
    }

    /**
     * Number of scheduled tasks that have neither run nor been cancelled.
     */
    public synchronized int pendingTasks() {
        return (int) queue.stream().filter(s -> !s.ran.get()).count();
    }

    private synchronized Scheduled pollDue() {
        Scheduled head = queue.peek();
        if (head == null || head.deadlineNanos > clock.nowNanos()) {
            return null;
        }
        return queue.poll();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        // Set on run or cancel: either one wins.
        private final AtomicBoolean ran = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return ran.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}
