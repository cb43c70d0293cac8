package com.questrail.telerelay.time;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called. Tasks scheduled
 * by a running task with a deadline already due run in the same call.
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
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        Scheduled next;
        while ((next = pollDue()) != null) {
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /**
     * Number of scheduled tasks that are neither run nor cancelled.
     */
    public synchronized long pendingCount() {
        return queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private synchronized Scheduled pollDue() {
        if (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            return queue.poll();
        }
        return null;
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int c = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return c != 0 ? c : Long.compare(this.sequence, o.sequence);
        }
    }
}
