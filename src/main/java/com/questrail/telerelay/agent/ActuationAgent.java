package com.questrail.telerelay.agent;

import com.questrail.telerelay.agent.hardware.PositionProvider;
import com.questrail.telerelay.agent.hardware.VoltageActuator;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.protocol.model.Acknowledgement;
import com.questrail.telerelay.protocol.model.Command;
import com.questrail.telerelay.protocol.model.RelayMessage;
import com.questrail.telerelay.time.MonotonicClock;
import com.questrail.telerelay.time.MonotonicScheduler;
import com.questrail.telerelay.time.WallClock;
import com.questrail.telerelay.transport.PeerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * ActuationAgent
 * -----------------------------------------------------------------------------
 * Applies every forwarded command and answers it immediately.
 *
 * <p>The acknowledgement echoes the command's request id and carries
 * {@code t2} (wall-clock time the command was received) and {@code t3}
 * (wall-clock time just before the reply is sent), together with the applied
 * voltage and the latest position fix.</p>
 *
 * <p>The actuator is driven to its safe state whenever the connection is
 * lost or the agent stops.</p>
 */
public final class ActuationAgent extends AbstractAgent
{
    private static final Logger log = LoggerFactory.getLogger(ActuationAgent.class);

    private final VoltageActuator actuator;
    private final PositionProvider positions;
    private final WallClock wallClock;

    public ActuationAgent(AgentConfig config,
                          PeerConnector connector,
                          VoltageActuator actuator,
                          PositionProvider positions,
                          MonotonicScheduler scheduler,
                          MonotonicClock monotonicClock,
                          WallClock wallClock)
    {
        super(config, connector, scheduler, monotonicClock);
        if (config.role() != Role.ACTUATION) {
            throw new IllegalArgumentException("ActuationAgent requires an actuation config");
        }
        this.actuator = Objects.requireNonNull(actuator, "actuator");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    protected void onConnected(PeerConnection connection)
    {
    }

    @Override
    protected void onDisconnected(PeerConnection connection)
    {
        actuator.reset();
        log.info("Actuator driven to safe state");
    }

    @Override
    public void onMessage(PeerConnection connection, RelayMessage message)
    {
        double t2 = wallClock.nowEpochSeconds();
        if (!(message instanceof Command command)) {
            log.debug("Ignoring {} from relay", message.getClass().getSimpleName());
            return;
        }

        double applied = actuator.apply(command.voltage(), command.status());
        log.debug("Command {}: {} {} V, applied {} V",
                command.requestId(), command.status().label(), command.voltage(), applied);

        Acknowledgement ack = new Acknowledgement(
                OptionalLong.of(command.requestId()),
                t2,
                wallClock.nowEpochSeconds(),
                OptionalDouble.of(applied),
                positions.latestFix());
        try {
            connection.send(ack);
        } catch (ConnectionLostException e) {
            log.debug("Acknowledgement {} not sent: {}", command.requestId(), e.getMessage());
        }
    }
}
