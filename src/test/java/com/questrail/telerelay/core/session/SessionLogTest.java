package com.questrail.telerelay.core.session;

import com.questrail.telerelay.core.latency.LatencyEstimator;
import com.questrail.telerelay.protocol.model.Acknowledgement;
import com.questrail.telerelay.protocol.model.DataStatus;
import com.questrail.telerelay.protocol.model.TelemetryPacket;
import com.questrail.telerelay.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

final class SessionLogTest {

    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final SessionLog log = new SessionLog(clock);

    private LatencyRecord appendCycle(long requestId, double t1) {
        TelemetryPacket packet = new TelemetryPacket(1.5, DataStatus.PROPER, Optional.empty(), t1);
        Acknowledgement ack = new Acknowledgement(
                OptionalLong.of(requestId), t1 + 0.05, t1 + 0.06, OptionalDouble.of(1.5), Optional.empty());
        return log.append(requestId, packet, ack, LatencyEstimator.estimate(t1, t1 + 0.05, t1 + 0.06, t1 + 0.12));
    }

    @Test
    void startsInactive() {
        assertEquals(SessionState.INACTIVE, log.state());
        assertEquals(0, log.size());
    }

    @Test
    void appendWithoutActiveSessionIsRejected() {
        assertThrows(IllegalStateException.class, () -> appendCycle(1, 100.0));
    }

    @Test
    void sequenceNumbersAreDenseAcrossTimeouts() {
        log.start();
        log.recordAttempt("127.0.0.1:5000");
        assertEquals(1, appendCycle(1, 100.0).sequence());

        log.recordAttempt("127.0.0.1:5000");
        log.recordTimeout();

        log.recordAttempt("127.0.0.1:5000");
        LatencyRecord third = appendCycle(3, 101.0);

        assertEquals(2, third.sequence());
        assertEquals(3, third.requestId());
        assertEquals(55.0, third.delayMillis(), 1e-6);
    }

    @Test
    void startDiscardsPreviousRecords() {
        log.start();
        appendCycle(1, 100.0);
        appendCycle(2, 100.5);

        log.start();

        assertEquals(0, log.size());
        assertTrue(log.delaySamplesMs().isEmpty());
        assertEquals(1, appendCycle(3, 101.0).sequence());
    }

    @Test
    void stopReturnsSummaryOnceAndSecondStopIsNoOp() {
        log.start();
        log.recordAttempt("10.0.0.2:41000");
        appendCycle(1, 100.0);
        log.recordAttempt("10.0.0.2:41000");
        log.recordTimeout();
        clock.advanceMillis(3000);

        SessionSummary summary = log.stop(SessionStopReason.OPERATOR_REQUEST).orElseThrow();

        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), summary.startedAt());
        assertEquals(Instant.parse("2026-03-01T10:00:03Z"), summary.stoppedAt());
        assertEquals(Optional.of("10.0.0.2:41000"), summary.actuationPeer());
        assertEquals(1, summary.records().size());
        assertEquals(2, summary.cyclesAttempted());
        assertEquals(1, summary.cyclesTimedOut());
        assertEquals(55.0, summary.meanDelayMs(), 1e-6);
        assertEquals(SessionState.INACTIVE, log.state());

        assertTrue(log.stop(SessionStopReason.OPERATOR_REQUEST).isEmpty());
    }

    @Test
    void recordsSurviveStopUntilNextStart() {
        log.start();
        appendCycle(1, 100.0);
        log.stop(SessionStopReason.SHUTDOWN);

        assertEquals(1, log.size());
    }

    @Test
    void emptySummaryHasZeroMeanAndNoExtremes() {
        log.start();
        SessionSummary summary = log.stop(SessionStopReason.MEASUREMENT_PEER_LOST).orElseThrow();

        assertTrue(summary.isEmpty());
        assertEquals(0.0, summary.meanDelayMs());
        assertTrue(summary.minDelayMs().isEmpty());
        assertTrue(summary.maxDelayMs().isEmpty());
    }
}
