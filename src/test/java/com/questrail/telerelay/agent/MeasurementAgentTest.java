package com.questrail.telerelay.agent;

import com.questrail.telerelay.agent.hardware.SensorReading;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.core.peer.FakePeerConnection;
import com.questrail.telerelay.protocol.model.Command;
import com.questrail.telerelay.protocol.model.DataStatus;
import com.questrail.telerelay.protocol.model.GeoPosition;
import com.questrail.telerelay.protocol.model.Hello;
import com.questrail.telerelay.protocol.model.TelemetryPacket;
import com.questrail.telerelay.time.DeterministicScheduler;
import com.questrail.telerelay.time.ManualMonotonicClock;
import com.questrail.telerelay.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.Queue;

import static org.junit.jupiter.api.Assertions.*;

final class MeasurementAgentTest {

    private static final GeoPosition FIX = new GeoPosition(51.5, -0.12);

    private final ManualMonotonicClock monotonic = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(monotonic);
    private final ManualWallClock wall = ManualWallClock.atEpochSeconds(1000.0);
    private final FakePeerConnector connector = new FakePeerConnector(Role.MEASUREMENT);
    private final Queue<SensorReading> readings = new ArrayDeque<>();

    private MeasurementAgent agent;

    @BeforeEach
    void setUp() {
        AgentConfig config = AgentConfig.builder(Role.MEASUREMENT)
                .withAgentId("sensor_pi")
                .withReportInterval(Duration.ofMillis(500))
                .withReconnectDelay(Duration.ofSeconds(5))
                .build();
        agent = new MeasurementAgent(config, connector,
                () -> readings.isEmpty() ? new SensorReading(1.0, DataStatus.PROPER) : readings.remove(),
                () -> Optional.of(FIX), scheduler, monotonic, wall);
    }

    private void advanceMillis(long millis) {
        monotonic.advanceMillis(millis);
        wall.advanceMillis(millis);
        scheduler.runDueTasks();
    }

    @Test
    void connectSendsHelloThenTheFirstSample() {
        readings.add(new SensorReading(2.25, DataStatus.PROPER));

        agent.start();
        scheduler.runDueTasks();

        assertTrue(agent.isConnected());
        List<?> sent = connector.last().sent();
        assertEquals(new Hello("sensor_pi", Role.MEASUREMENT), sent.get(0));
        assertEquals(new TelemetryPacket(2.25, DataStatus.PROPER, Optional.of(FIX), 1000.0), sent.get(1));
    }

    @Test
    void samplesFollowTheReportInterval() {
        agent.start();
        scheduler.runDueTasks();

        advanceMillis(499);
        assertEquals(1, connector.last().sent(TelemetryPacket.class).size());

        advanceMillis(1);
        advanceMillis(500);
        List<TelemetryPacket> packets = connector.last().sent(TelemetryPacket.class);
        assertEquals(3, packets.size());
        assertEquals(1001.0, packets.get(2).sendTime(), 1e-9);
    }

    @Test
    void junkReadingsAreSentAsJunk() {
        readings.add(SensorReading.junk());

        agent.start();
        scheduler.runDueTasks();

        TelemetryPacket packet = connector.last().sent(TelemetryPacket.class).get(0);
        assertEquals(DataStatus.JUNK, packet.status());
        assertEquals(0.0, packet.voltage());
    }

    @Test
    void refusedConnectionIsRetriedAfterTheReconnectDelay() {
        connector.refuse(1);

        agent.start();
        scheduler.runDueTasks();
        assertFalse(agent.isConnected());
        assertEquals(1, connector.attempts());

        advanceMillis(4999);
        assertEquals(1, connector.attempts());

        advanceMillis(1);
        assertEquals(2, connector.attempts());
        assertTrue(agent.isConnected());
    }

    @Test
    void lostConnectionStopsSamplingAndReconnects() {
        agent.start();
        scheduler.runDueTasks();
        FakePeerConnection first = connector.last();

        first.close();
        agent.onClosed(first, new IllegalStateException("reset by peer"));
        assertFalse(agent.isConnected());

        advanceMillis(1000);
        assertEquals(1, first.sent(TelemetryPacket.class).size());

        advanceMillis(4000);
        assertEquals(2, connector.opened().size());
        FakePeerConnection second = connector.last();
        assertInstanceOf(Hello.class, second.sent().get(0));
        assertEquals(1, second.sent(TelemetryPacket.class).size());
    }

    @Test
    void closeOfAStaleConnectionIsIgnored() {
        agent.start();
        scheduler.runDueTasks();

        agent.onClosed(new FakePeerConnection(Role.MEASUREMENT, 1), null);

        assertTrue(agent.isConnected());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void stopClosesTheConnectionAndCancelsEverything() {
        agent.start();
        scheduler.runDueTasks();

        agent.stop();

        assertTrue(connector.last().isClosed());
        assertFalse(agent.isConnected());
        assertEquals(0, scheduler.pendingCount());
        assertFalse(connector.isShutdown());
    }

    @Test
    void commandsFromTheRelayAreIgnored() {
        agent.start();
        scheduler.runDueTasks();

        agent.onMessage(connector.last(), new Command(1, 1.0, DataStatus.PROPER));

        assertEquals(2, connector.last().sent().size());
    }
}
