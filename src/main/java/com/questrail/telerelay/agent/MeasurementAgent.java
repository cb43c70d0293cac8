package com.questrail.telerelay.agent;

import com.questrail.telerelay.agent.hardware.PositionProvider;
import com.questrail.telerelay.agent.hardware.SensorReading;
import com.questrail.telerelay.agent.hardware.VoltageSensor;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.protocol.model.RelayMessage;
import com.questrail.telerelay.protocol.model.TelemetryPacket;
import com.questrail.telerelay.time.Cancellable;
import com.questrail.telerelay.time.MonotonicClock;
import com.questrail.telerelay.time.MonotonicScheduler;
import com.questrail.telerelay.time.WallClock;
import com.questrail.telerelay.transport.PeerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * MeasurementAgent
 * -----------------------------------------------------------------------------
 * Samples the voltage sensor every {@link AgentConfig#reportInterval()} while
 * connected and sends each sample, stamped with the wall-clock send time and
 * the latest position fix, as a {@code sensor_data} packet.
 */
public final class MeasurementAgent extends AbstractAgent
{
    private static final Logger log = LoggerFactory.getLogger(MeasurementAgent.class);

    private final VoltageSensor sensor;
    private final PositionProvider positions;
    private final WallClock wallClock;

    private volatile Cancellable pendingReport;

    public MeasurementAgent(AgentConfig config,
                            PeerConnector connector,
                            VoltageSensor sensor,
                            PositionProvider positions,
                            MonotonicScheduler scheduler,
                            MonotonicClock monotonicClock,
                            WallClock wallClock)
    {
        super(config, connector, scheduler, monotonicClock);
        if (config.role() != Role.MEASUREMENT) {
            throw new IllegalArgumentException("MeasurementAgent requires a measurement config");
        }
        this.sensor = Objects.requireNonNull(sensor, "sensor");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    protected void onConnected(PeerConnection connection)
    {
        report(connection);
    }

    @Override
    protected void onDisconnected(PeerConnection connection)
    {
        Cancellable c = pendingReport;
        if (c != null) {
            c.cancel();
        }
    }

    @Override
    public void onMessage(PeerConnection connection, RelayMessage message)
    {
        log.debug("Ignoring {} from relay", message.getClass().getSimpleName());
    }

    private void report(PeerConnection target)
    {
        if (connection().orElse(null) != target) {
            return;
        }

        SensorReading reading = sensor.read();
        TelemetryPacket packet = new TelemetryPacket(
                reading.voltage(), reading.status(), positions.latestFix(), wallClock.nowEpochSeconds());
        try {
            target.send(packet);
            log.debug("Sent {} sample {} V", reading.status().label(), reading.voltage());
        } catch (ConnectionLostException e) {
            // onClosed follows and schedules the reconnect.
            log.debug("Telemetry not sent: {}", e.getMessage());
            return;
        }

        pendingReport = scheduler.scheduleAfter(config.reportInterval(), monotonicClock, () -> report(target));
    }
}
