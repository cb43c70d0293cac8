package com.questrail.telerelay.core.correlate;

import com.questrail.telerelay.protocol.model.Acknowledgement;

import java.time.Duration;
import java.util.Optional;

/**
 * ResponseCorrelator
 * =============================================================================
 * Hand-off of {@link Acknowledgement}s from the actuation reader (producer) to
 * the relay loop (consumer).
 *
 * <h2>Threading contract</h2>
 * <ul>
 *   <li>{@link #publish} is called by the actuation reader; it never blocks
 *       and never drops.</li>
 *   <li>At most one {@code await*} call may be outstanding at a time. The relay
 *       loop is single-flight by construction; a concurrent second waiter is a
 *       programming error and is rejected with {@link IllegalStateException}.</li>
 * </ul>
 */
public interface ResponseCorrelator
{
    /**
     * Enqueue an acknowledgement and wake the waiting consumer, if any.
     */
    void publish(Acknowledgement ack);

    /**
     * Remove and return the oldest enqueued acknowledgement, waiting up to
     * {@code deadline} for one to arrive.
     *
     * <p>Matching is purely positional. If the actuation agent ever answers a
     * stale or out-of-order command, the answer is paired with whichever
     * request is waiting.</p>
     *
     * @return the acknowledgement, or empty on timeout
     */
    Optional<Acknowledgement> awaitNext(Duration deadline) throws InterruptedException;

    /**
     * Wait up to {@code deadline} for the acknowledgement of {@code requestId}.
     *
     * <p>Acknowledgements carrying an older request id are stale and are
     * discarded. Acknowledgements without a request id are matched
     * positionally, as in {@link #awaitNext}.</p>
     *
     * @return the acknowledgement, or empty on timeout
     */
    Optional<Acknowledgement> awaitResponse(long requestId, Duration deadline) throws InterruptedException;

    /**
     * Drop every queued acknowledgement.
     */
    void clear();

    /**
     * Number of queued acknowledgements.
     */
    int pending();
}
