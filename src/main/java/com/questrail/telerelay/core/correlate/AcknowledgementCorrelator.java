package com.questrail.telerelay.core.correlate;

import com.questrail.telerelay.protocol.model.Acknowledgement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AcknowledgementCorrelator
 * =============================================================================
 * Lock-and-condition implementation of {@link ResponseCorrelator}.
 *
 * <p>The consumer suspends on a {@link Condition} until an acknowledgement is
 * published or its deadline elapses; there is no polling interval.</p>
 *
 * <h2>Matching rules for {@link #awaitResponse}</h2>
 * Queued acknowledgements are scanned oldest first:
 * <ol>
 *   <li>an acknowledgement with the awaited request id is taken;</li>
 *   <li>an acknowledgement without a request id is taken (positional fallback);</li>
 *   <li>an acknowledgement with an older request id is discarded as stale;</li>
 *   <li>an acknowledgement with a newer request id is left queued.</li>
 * </ol>
 */
public final class AcknowledgementCorrelator implements ResponseCorrelator
{
    private static final Logger log = LoggerFactory.getLogger(AcknowledgementCorrelator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition arrived = lock.newCondition();
    private final Deque<Acknowledgement> queue = new ArrayDeque<>();

    private final AtomicBoolean awaiting = new AtomicBoolean(false);
    private final AtomicLong staleDiscarded = new AtomicLong();

    @Override
    public void publish(Acknowledgement ack)
    {
        Objects.requireNonNull(ack, "ack");
        lock.lock();
        try {
            queue.addLast(ack);
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Acknowledgement> awaitNext(Duration deadline) throws InterruptedException
    {
        return await(deadline, AwaitedRequest.ANY);
    }

    @Override
    public Optional<Acknowledgement> awaitResponse(long requestId, Duration deadline) throws InterruptedException
    {
        return await(deadline, new AwaitedRequest(requestId));
    }

    @Override
    public void clear()
    {
        lock.lock();
        try {
            queue.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int pending()
    {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of acknowledgements discarded because they answered an older request.
     */
    public long staleDiscarded()
    {
        return staleDiscarded.get();
    }

    private Optional<Acknowledgement> await(Duration deadline, AwaitedRequest request) throws InterruptedException
    {
        Objects.requireNonNull(deadline, "deadline");
        if (deadline.isNegative()) {
            throw new IllegalArgumentException("deadline must be >= 0");
        }
        if (!awaiting.compareAndSet(false, true)) {
            throw new IllegalStateException("Another await is already outstanding");
        }

        try {
            long remaining = deadline.toNanos();
            lock.lockInterruptibly();
            try {
                while (true) {
                    Acknowledgement match = take(request);
                    if (match != null) {
                        return Optional.of(match);
                    }
                    if (remaining <= 0L) {
                        return Optional.empty();
                    }
                    remaining = arrived.awaitNanos(remaining);
                }
            } finally {
                lock.unlock();
            }
        } finally {
            awaiting.set(false);
        }
    }

    /** Caller holds the lock. */
    private Acknowledgement take(AwaitedRequest request)
    {
        if (request.isAny()) {
            return queue.pollFirst();
        }

        Iterator<Acknowledgement> it = queue.iterator();
        while (it.hasNext()) {
            Acknowledgement ack = it.next();
            if (ack.requestId().isEmpty()) {
                it.remove();
                return ack;
            }
            long id = ack.requestId().getAsLong();
            if (id == request.id()) {
                it.remove();
                return ack;
            }
            if (id < request.id()) {
                it.remove();
                staleDiscarded.incrementAndGet();
                log.warn("Discarding stale acknowledgement for request {} while awaiting {}", id, request.id());
            }
        }
        return null;
    }

    private record AwaitedRequest(long id)
    {
        static final AwaitedRequest ANY = new AwaitedRequest(Long.MIN_VALUE);

        boolean isAny()
        {
            return id == Long.MIN_VALUE;
        }
    }
}
