package com.questrail.telerelay.runtime;

import com.questrail.telerelay.agent.ActuationAgent;
import com.questrail.telerelay.agent.MeasurementAgent;
import com.questrail.telerelay.agent.hardware.DacVoltageActuator;
import com.questrail.telerelay.agent.hardware.ThresholdVoltageSensor;
import com.questrail.telerelay.agent.hardware.sim.SimulatedDacOutput;
import com.questrail.telerelay.api.RelayStatus;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.config.RelayConfig;
import com.questrail.telerelay.core.relay.RelayTimingPolicy;
import com.questrail.telerelay.core.session.LatencyRecord;
import com.questrail.telerelay.core.session.SessionState;
import com.questrail.telerelay.core.session.SessionStopReason;
import com.questrail.telerelay.core.session.SessionSummary;
import com.questrail.telerelay.protocol.codec.impl.JsonMessageCodec;
import com.questrail.telerelay.protocol.model.DataStatus;
import com.questrail.telerelay.protocol.model.GeoPosition;
import com.questrail.telerelay.time.ScheduledExecutorScheduler;
import com.questrail.telerelay.time.SystemMonotonicClock;
import com.questrail.telerelay.time.SystemWallClock;
import com.questrail.telerelay.transport.tcp.netty.NettyPeerConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Relay plus both agents over loopback sockets.
 */
final class RelayRuntimeEndToEndTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final GeoPosition SENSOR_FIX = new GeoPosition(48.1, 11.6);
    private static final GeoPosition ACTUATOR_FIX = new GeoPosition(48.2, 11.7);

    private final List<SessionSummary> reports = new CopyOnWriteArrayList<>();
    private final List<RelayStatus> statusUpdates = new CopyOnWriteArrayList<>();

    private RelayRuntime relay;
    private ScheduledExecutorService agentThreads;
    private NettyPeerConnector measurementConnector;
    private NettyPeerConnector actuationConnector;
    private MeasurementAgent measurementAgent;
    private ActuationAgent actuationAgent;

    @BeforeEach
    void setUp() {
        InetSocketAddress ephemeral = new InetSocketAddress("127.0.0.1", 0);
        relay = RelayRuntime.builder()
                .withConfig(RelayConfig.builder()
                        .withMeasurementBind(ephemeral)
                        .withActuationBind(ephemeral)
                        .withTimingPolicy(new RelayTimingPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2)))
                        .build())
                .withReportLogging(false)
                .withReportSink(reports::add)
                .withStatusCallback(statusUpdates::add)
                .build();
        relay.start();

        agentThreads = Executors.newScheduledThreadPool(2);
        ScheduledExecutorScheduler scheduler = new ScheduledExecutorScheduler(agentThreads, SystemMonotonicClock.INSTANCE);

        InetSocketAddress measurementPort = (InetSocketAddress) relay.measurementAddress().orElseThrow();
        InetSocketAddress actuationPort = (InetSocketAddress) relay.actuationAddress().orElseThrow();

        AgentConfig measurementConfig = AgentConfig.builder(Role.MEASUREMENT)
                .withAgentId("sensor_pi")
                .withRelayAddress(measurementPort)
                .withReportInterval(Duration.ofMillis(20))
                .withReconnectDelay(Duration.ofMillis(200))
                .build();
        AgentConfig actuationConfig = AgentConfig.builder(Role.ACTUATION)
                .withAgentId("actuator_pi")
                .withRelayAddress(actuationPort)
                .withReconnectDelay(Duration.ofMillis(200))
                .build();

        measurementConnector = new NettyPeerConnector(Role.MEASUREMENT, measurementPort, new JsonMessageCodec(),
                measurementConfig.maxFrameLength(), measurementConfig.connectTimeout(), SystemWallClock.INSTANCE);
        actuationConnector = new NettyPeerConnector(Role.ACTUATION, actuationPort, new JsonMessageCodec(),
                actuationConfig.maxFrameLength(), actuationConfig.connectTimeout(), SystemWallClock.INSTANCE);

        measurementAgent = new MeasurementAgent(measurementConfig, measurementConnector,
                new ThresholdVoltageSensor(() -> 1.65), () -> Optional.of(SENSOR_FIX),
                scheduler, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
        actuationAgent = new ActuationAgent(actuationConfig, actuationConnector,
                new DacVoltageActuator(new SimulatedDacOutput()), () -> Optional.of(ACTUATOR_FIX),
                scheduler, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    @AfterEach
    void tearDown() throws Exception {
        measurementAgent.stop();
        actuationAgent.stop();
        relay.stop();
        measurementConnector.shutdown();
        actuationConnector.shutdown();
        agentThreads.shutdownNow();
        agentThreads.awaitTermination(5, TimeUnit.SECONDS);
    }

    private void connectBothAgents() {
        actuationAgent.start();
        measurementAgent.start();
        await().atMost(TIMEOUT).until(() -> relay.status().readyToRelay());
    }

    @Test
    void sessionRecordsCorrectedDelaysUntilStopped() throws Exception {
        connectBothAgents();

        relay.startSession().get();
        await().atMost(TIMEOUT).until(() -> relay.status().recordCount() >= 5);

        SessionSummary summary = relay.stopSession().get().orElseThrow();

        assertEquals(SessionStopReason.OPERATOR_REQUEST, summary.stopReason());
        assertTrue(summary.records().size() >= 5);
        for (int i = 0; i < summary.records().size(); i++) {
            LatencyRecord record = summary.records().get(i);
            assertEquals(i + 1, record.sequence());
            assertEquals(DataStatus.PROPER, record.status());
            assertEquals(1.65, record.measuredVoltage());
            assertEquals(SENSOR_FIX, record.measurementPosition().orElseThrow());
            assertEquals(ACTUATOR_FIX, record.actuationPosition().orElseThrow());
            assertTrue(Double.isFinite(record.delayMillis()));
        }
        assertEquals(List.of(summary), reports);

        RelayStatus status = relay.status();
        assertEquals(SessionState.INACTIVE, status.sessionState());
        assertTrue(status.measurementPeer().orElseThrow().startsWith("sensor_pi@"));
        assertTrue(status.actuationPeer().orElseThrow().startsWith("actuator_pi@"));
        assertFalse(statusUpdates.isEmpty());
    }

    @Test
    void nothingIsRecordedOutsideASession() {
        connectBothAgents();

        await().pollDelay(Duration.ofMillis(200)).atMost(TIMEOUT)
                .until(() -> relay.status().measurementPosition().isPresent());

        assertEquals(0, relay.status().recordCount());
        assertTrue(reports.isEmpty());
    }

    @Test
    void losingTheActuationAgentStopsTheSession() throws Exception {
        connectBothAgents();
        relay.startSession().get();
        await().atMost(TIMEOUT).until(() -> relay.status().recordCount() >= 1);

        actuationAgent.stop();

        await().atMost(TIMEOUT).until(() -> reports.size() == 1);
        assertEquals(SessionStopReason.ACTUATION_PEER_LOST, reports.get(0).stopReason());
        assertEquals(SessionState.INACTIVE, relay.status().sessionState());
        assertFalse(relay.status().actuationConnected());
        assertTrue(relay.stopSession().get().isEmpty());
    }

    @Test
    void reconnectingAgentIsAcceptedAfterLoss() {
        connectBothAgents();

        actuationAgent.stop();
        await().atMost(TIMEOUT).until(() -> !relay.status().actuationConnected());

        actuationAgent.start();
        await().atMost(TIMEOUT).until(() -> relay.status().actuationConnected());
    }

    @Test
    void shutdownFinalizesTheActiveSession() throws Exception {
        connectBothAgents();
        relay.startSession().get();
        await().atMost(TIMEOUT).until(() -> relay.status().recordCount() >= 1);

        measurementAgent.stop();
        actuationAgent.stop();
        relay.stop();

        // Agent loss may win the race against the shutdown stop.
        assertEquals(1, reports.size());
        assertTrue(List.of(SessionStopReason.SHUTDOWN, SessionStopReason.MEASUREMENT_PEER_LOST,
                SessionStopReason.ACTUATION_PEER_LOST).contains(reports.get(0).stopReason()));
    }

    @Test
    void sessionStartedBeforeAgentsConnectRecordsOnceTheyDo() throws Exception {
        relay.startSession().get();
        assertEquals(SessionState.ACTIVE, relay.status().sessionState());
        assertFalse(relay.status().readyToRelay());

        connectBothAgents();

        await().atMost(TIMEOUT).until(() -> relay.status().recordCount() >= 1);
    }
}
