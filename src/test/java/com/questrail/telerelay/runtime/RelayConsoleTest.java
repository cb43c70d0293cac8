package com.questrail.telerelay.runtime;

import com.questrail.telerelay.api.RelayStatus;
import com.questrail.telerelay.api.TelemetryRelay;
import com.questrail.telerelay.core.session.LatencyRecord;
import com.questrail.telerelay.core.session.SessionState;
import com.questrail.telerelay.core.session.SessionStopReason;
import com.questrail.telerelay.core.session.SessionSummary;
import com.questrail.telerelay.protocol.model.DataStatus;
import com.questrail.telerelay.protocol.model.GeoPosition;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class RelayConsoleTest {

    /** Scripted relay: answers with whatever the test put in its fields. */
    private static final class ScriptedRelay implements TelemetryRelay {
        RelayStatus status = new RelayStatus(Optional.empty(), Optional.empty(), SessionState.INACTIVE, 0,
                Optional.empty(), Optional.empty());
        Optional<SessionSummary> stopResult = Optional.empty();
        RuntimeException failure;
        int starts;
        int stops;

        @Override
        public CompletableFuture<Void> startSession() {
            starts++;
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Optional<SessionSummary>> stopSession() {
            stops++;
            return CompletableFuture.completedFuture(stopResult);
        }

        @Override
        public RelayStatus status() {
            return status;
        }
    }

    private final ScriptedRelay relay = new ScriptedRelay();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private String run(String input) throws Exception {
        RelayConsole console = new RelayConsole(relay, new BufferedReader(new StringReader(input)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
        console.run();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static SessionSummary summary(double... delaysMs) {
        List<LatencyRecord> records = new ArrayList<>();
        List<Double> samples = new ArrayList<>();
        for (int i = 0; i < delaysMs.length; i++) {
            records.add(new LatencyRecord(i + 1, i + 1, 100.0 + i, 100.0 + i + delaysMs[i] / 1000.0, delaysMs[i],
                    1.0, DataStatus.PROPER, OptionalDouble.of(1.0), Optional.empty(), Optional.empty()));
            samples.add(delaysMs[i]);
        }
        return new SessionSummary(Instant.EPOCH, Instant.EPOCH.plusSeconds(60), SessionStopReason.OPERATOR_REQUEST,
                Optional.empty(), records, samples, delaysMs.length, 0);
    }

    @Test
    void startWithoutAgentsWarnsThatNothingIsLoggedYet() throws Exception {
        String out = run("start\nquit\n");

        assertEquals(1, relay.starts);
        assertTrue(out.contains("Session started."));
        assertTrue(out.contains("Waiting for both agents"));
    }

    @Test
    void startWithBothAgentsDoesNotWarn() throws Exception {
        relay.status = new RelayStatus(Optional.of("10.0.0.2:5000"), Optional.of("10.0.0.3:5001"),
                SessionState.ACTIVE, 0, Optional.empty(), Optional.empty());

        String out = run("START\n");

        assertTrue(out.contains("Session started."));
        assertFalse(out.contains("Waiting"));
    }

    @Test
    void stopReportsRecordCountAndAverageDelay() throws Exception {
        relay.stopResult = Optional.of(summary(10.0, 20.0, 30.0));

        String out = run("stop\n");

        assertTrue(out.contains("Session stopped. 3 records, average delay 20.00 ms."), out);
    }

    @Test
    void stopOfAnEmptySessionSaysSo() throws Exception {
        relay.stopResult = Optional.of(summary());

        assertTrue(run("stop\n").contains("Session stopped. No data was logged."));
    }

    @Test
    void stopWithoutASessionSaysSo() throws Exception {
        assertTrue(run("stop\n").contains("No session is active."));
    }

    @Test
    void statusShowsPeersAndPositions() throws Exception {
        relay.status = new RelayStatus(Optional.of("10.0.0.2:5000"), Optional.empty(),
                SessionState.ACTIVE, 4, Optional.of(new GeoPosition(1.5, 2.5)), Optional.empty());

        String out = run("status\n");

        assertTrue(out.contains("Measurement: 10.0.0.2:5000 at (1.5, 2.5)"), out);
        assertTrue(out.contains("Actuation:   not connected"), out);
        assertTrue(out.contains("ACTIVE (4 records)"), out);
    }

    @Test
    void quitStopsReadingFurtherCommands() throws Exception {
        run("quit\nstart\n");

        assertEquals(0, relay.starts);
    }

    @Test
    void unknownCommandsAndFailuresKeepTheConsoleRunning() throws Exception {
        relay.failure = new IllegalStateException("relay is shutting down");

        String out = run("bogus\nstart\nstop\n");

        assertTrue(out.contains("Unknown command: bogus"));
        assertTrue(out.contains("Command failed: relay is shutting down"));
        assertEquals(1, relay.stops);
    }
}
