package com.questrail.telerelay.core.peer;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.protocol.model.RelayMessage;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Optional;

/**
 * PeerConnection
 * -----------------------------------------------------------------------------
 * One live bidirectional channel to an agent.
 *
 * <p>Implementations live in the transport layer and never expose framework
 * types. The relay core only sends semantic messages and closes the handle.</p>
 *
 * <h2>Lifecycle</h2>
 * A connection is created on accept, becomes <em>identified</em> once its
 * {@code hello} has been received, and is destroyed on disconnect, read error
 * or replacement by a newer connection for the same role.
 */
public interface PeerConnection
{
    /**
     * The role of the listener that accepted this connection (relay side) or
     * the role of the local agent (agent side).
     */
    Role role();

    SocketAddress remoteAddress();

    Instant connectedAt();

    /**
     * Agent name announced in the handshake, once received.
     */
    Optional<String> agentId();

    /**
     * Records the agent name announced in the handshake.
     */
    void identify(String agentId);

    /**
     * Whether the underlying channel is still open.
     */
    boolean isAlive();

    /**
     * Send a message to the remote agent.
     *
     * @throws ConnectionLostException if the channel is no longer open
     */
    void send(RelayMessage message);

    /**
     * Close the channel. Idempotent.
     */
    void close();
}
