package com.questrail.telerelay.core.correlate;

import com.questrail.telerelay.protocol.model.Acknowledgement;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class AcknowledgementCorrelatorTest {

    private final AcknowledgementCorrelator correlator = new AcknowledgementCorrelator();

    private static Acknowledgement ack(long requestId, double t2) {
        return new Acknowledgement(OptionalLong.of(requestId), t2, t2 + 0.01, OptionalDouble.empty(), Optional.empty());
    }

    private static Acknowledgement legacyAck(double t2) {
        return new Acknowledgement(OptionalLong.empty(), t2, t2 + 0.01, OptionalDouble.empty(), Optional.empty());
    }

    @Test
    void timesOutWhenNothingArrives() throws Exception {
        long start = System.nanoTime();
        Optional<Acknowledgement> result = correlator.awaitResponse(1, Duration.ofMillis(50));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(result.isEmpty());
        assertTrue(elapsedMs >= 40, "returned after " + elapsedMs + " ms");
    }

    @Test
    void queuedAcknowledgementIsReturnedImmediately() throws Exception {
        correlator.publish(ack(1, 10.0));

        assertEquals(Optional.of(ack(1, 10.0)), correlator.awaitResponse(1, Duration.ZERO));
        assertEquals(0, correlator.pending());
    }

    @Test
    void waiterIsWokenByPublish() throws Exception {
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<Acknowledgement>> waiting = exec.submit(() -> correlator.awaitResponse(5, Duration.ofSeconds(5)));
            Thread.sleep(20);
            correlator.publish(ack(5, 1.0));

            assertEquals(Optional.of(ack(5, 1.0)), waiting.get(2, TimeUnit.SECONDS));
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void awaitNextIsFirstInFirstOut() throws Exception {
        correlator.publish(ack(1, 1.0));
        correlator.publish(ack(2, 2.0));

        assertEquals(1L, correlator.awaitNext(Duration.ZERO).orElseThrow().requestId().getAsLong());
        assertEquals(2L, correlator.awaitNext(Duration.ZERO).orElseThrow().requestId().getAsLong());
        assertTrue(correlator.awaitNext(Duration.ZERO).isEmpty());
    }

    @Test
    void staleAcknowledgementIsDiscardedAndNewerOneKept() throws Exception {
        correlator.publish(ack(3, 3.0));
        correlator.publish(ack(5, 5.0));
        correlator.publish(ack(4, 4.0));

        assertEquals(Optional.of(ack(4, 4.0)), correlator.awaitResponse(4, Duration.ZERO));
        assertEquals(1, correlator.staleDiscarded());
        assertEquals(1, correlator.pending());
        assertEquals(Optional.of(ack(5, 5.0)), correlator.awaitResponse(5, Duration.ZERO));
    }

    @Test
    void lateAcknowledgementForTimedOutRequestNeverMatchesTheNextOne() throws Exception {
        assertTrue(correlator.awaitResponse(1, Duration.ZERO).isEmpty());
        correlator.publish(ack(1, 1.0));

        assertTrue(correlator.awaitResponse(2, Duration.ofMillis(20)).isEmpty());
        assertEquals(1, correlator.staleDiscarded());
    }

    /**
     * Without request ids the correlator can only match by position: if two
     * commands were outstanding, the first waiter takes the older reply even
     * though it answered a different command.
     */
    @Test
    void acknowledgementsWithoutIdsAreMatchedByPositionEvenWhenMisaligned() throws Exception {
        Acknowledgement answerToFirst = legacyAck(1.0);
        Acknowledgement answerToSecond = legacyAck(2.0);
        correlator.publish(answerToFirst);
        correlator.publish(answerToSecond);

        // Waiting on behalf of the second command still yields the first reply.
        assertSame(answerToFirst, correlator.awaitResponse(2, Duration.ZERO).orElseThrow());
        assertSame(answerToSecond, correlator.awaitResponse(3, Duration.ZERO).orElseThrow());
    }

    @Test
    void clearDropsQueuedAcknowledgements() throws Exception {
        correlator.publish(ack(1, 1.0));
        correlator.publish(legacyAck(2.0));

        correlator.clear();

        assertEquals(0, correlator.pending());
        assertTrue(correlator.awaitNext(Duration.ZERO).isEmpty());
    }

    @Test
    void secondConcurrentWaiterIsRejected() throws Exception {
        ExecutorService exec = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        try {
            Future<Optional<Acknowledgement>> first = exec.submit(() -> {
                started.countDown();
                return correlator.awaitResponse(1, Duration.ofSeconds(5));
            });
            started.await();
            Thread.sleep(50);

            assertThrows(IllegalStateException.class, () -> correlator.awaitResponse(2, Duration.ZERO));

            correlator.publish(ack(1, 1.0));
            assertTrue(first.get(2, TimeUnit.SECONDS).isPresent());
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void negativeDeadlineIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> correlator.awaitNext(Duration.ofMillis(-1)));
    }
}
