package com.questrail.telerelay.observability;

import com.questrail.telerelay.api.Role;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a change of a peer slot.
 */
public record PeerStateEvent(
    Instant timestamp,
    Role role,
    Kind kind,
    SocketAddress remote,
    Optional<String> agentId,
    Throwable cause
) {
    public enum Kind {
        /** Connection accepted, handshake pending. */
        ACCEPTED,
        /** Handshake completed; the connection is now current for its role. */
        REGISTERED,
        /** A newer connection displaced this one. */
        REPLACED,
        /** The current connection closed or failed. */
        LOST,
        /** A connection that never became current (or was already replaced) closed. */
        DISCARDED
    }
}
