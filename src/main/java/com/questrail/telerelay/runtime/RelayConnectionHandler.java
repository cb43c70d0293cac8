package com.questrail.telerelay.runtime;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.core.correlate.ResponseCorrelator;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.core.peer.PeerRegistry;
import com.questrail.telerelay.core.relay.PositionBoard;
import com.questrail.telerelay.core.relay.RelayLoop;
import com.questrail.telerelay.core.session.SessionStopReason;
import com.questrail.telerelay.observability.PeerStateEvent;
import com.questrail.telerelay.observability.RelayObservabilitySink;
import com.questrail.telerelay.protocol.codec.MalformedMessageException;
import com.questrail.telerelay.protocol.model.Acknowledgement;
import com.questrail.telerelay.protocol.model.Hello;
import com.questrail.telerelay.protocol.model.RelayMessage;
import com.questrail.telerelay.protocol.model.TelemetryPacket;
import com.questrail.telerelay.time.WallClock;
import com.questrail.telerelay.transport.PeerAcceptorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * RelayConnectionHandler
 * =============================================================================
 * Connection semantics for one listener role.
 *
 * <h2>Handshake</h2>
 * The first message of every connection must be a {@code hello} naming the
 * listener's role. Only then does the connection become current in the
 * {@link PeerRegistry}, replacing any previous connection of that role.
 * Anything else before the handshake, or a role mismatch, terminates the
 * connection.
 *
 * <h2>Traffic</h2>
 * <ul>
 *   <li>measurement: every {@link TelemetryPacket} drives one relay cycle</li>
 *   <li>actuation: every {@link Acknowledgement} updates the actuator position
 *       and is published to the correlator</li>
 * </ul>
 * Traffic from a connection that has since been replaced is ignored.
 *
 * <h2>Loss</h2>
 * When the current connection of a role closes, the role is cleared and the
 * active session is stopped through {@code sessionStopper}. The stopper must
 * not block: the close notification may arrive on a thread that a relay
 * cycle is waiting on.
 */
final class RelayConnectionHandler implements PeerAcceptorListener
{
    private static final Logger log = LoggerFactory.getLogger(RelayConnectionHandler.class);

    private final Role role;
    private final PeerRegistry registry;
    private final RelayLoop relayLoop;
    private final ResponseCorrelator correlator;
    private final PositionBoard positions;
    private final Consumer<SessionStopReason> sessionStopper;
    private final RelayObservabilitySink observabilitySink;
    private final WallClock clock;

    RelayConnectionHandler(Role role,
                           PeerRegistry registry,
                           RelayLoop relayLoop,
                           ResponseCorrelator correlator,
                           PositionBoard positions,
                           Consumer<SessionStopReason> sessionStopper,
                           RelayObservabilitySink observabilitySink,
                           WallClock clock)
    {
        this.role = Objects.requireNonNull(role, "role");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.relayLoop = Objects.requireNonNull(relayLoop, "relayLoop");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.sessionStopper = Objects.requireNonNull(sessionStopper, "sessionStopper");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onAccepted(PeerConnection connection)
    {
        peerEvent(connection, PeerStateEvent.Kind.ACCEPTED, null);
    }

    @Override
    public void onMessage(PeerConnection connection, RelayMessage message)
    {
        if (message instanceof Hello hello) {
            onHello(connection, hello);
            return;
        }
        if (connection.agentId().isEmpty()) {
            throw new MalformedMessageException(
                    "Expected hello from " + connection.remoteAddress() + " but received " + describe(message));
        }
        if (!registry.isCurrent(connection)) {
            log.debug("Ignoring {} from replaced {} connection {}", describe(message), role.wireName(), connection.remoteAddress());
            return;
        }

        switch (role) {
            case MEASUREMENT -> {
                if (!(message instanceof TelemetryPacket packet)) {
                    throw unexpected(connection, message);
                }
                relayLoop.onTelemetry(packet);
            }
            case ACTUATION -> {
                if (!(message instanceof Acknowledgement ack)) {
                    throw unexpected(connection, message);
                }
                positions.update(Role.ACTUATION, ack.position());
                correlator.publish(ack);
            }
        }
    }

    @Override
    public void onClosed(PeerConnection connection, Throwable cause)
    {
        if (cause != null) {
            log.warn("{} connection {} failed: {}", role.wireName(), connection.remoteAddress(), cause.getMessage());
        }

        if (!registry.clear(role, connection)) {
            peerEvent(connection, PeerStateEvent.Kind.DISCARDED, cause);
            return;
        }

        peerEvent(connection, PeerStateEvent.Kind.LOST, cause);
        sessionStopper.accept(role == Role.MEASUREMENT
                ? SessionStopReason.MEASUREMENT_PEER_LOST
                : SessionStopReason.ACTUATION_PEER_LOST);
    }

    private void onHello(PeerConnection connection, Hello hello)
    {
        if (hello.role() != role) {
            throw new MalformedMessageException("Agent " + hello.agentId() + " announced role "
                    + hello.role().wireName() + " on the " + role.wireName() + " listener");
        }
        if (connection.agentId().isPresent()) {
            throw new MalformedMessageException("Duplicate hello from " + connection.remoteAddress());
        }

        connection.identify(hello.agentId());
        Optional<PeerConnection> replaced = registry.register(role, connection);
        replaced.ifPresent(old -> peerEvent(old, PeerStateEvent.Kind.REPLACED, null));
        peerEvent(connection, PeerStateEvent.Kind.REGISTERED, null);
    }

    private MalformedMessageException unexpected(PeerConnection connection, RelayMessage message)
    {
        return new MalformedMessageException(
                "Unexpected " + describe(message) + " on " + role.wireName() + " connection " + connection.remoteAddress());
    }

    private void peerEvent(PeerConnection connection, PeerStateEvent.Kind kind, Throwable cause)
    {
        observabilitySink.onPeerEvent(new PeerStateEvent(
                clock.now(), role, kind, connection.remoteAddress(), connection.agentId(), cause));
    }

    private static String describe(RelayMessage message)
    {
        return message.getClass().getSimpleName();
    }
}
