package com.questrail.telerelay.transport;

import com.questrail.telerelay.core.peer.PeerConnection;

/**
 * Callback sink for a {@link PeerAcceptor}.
 */
public interface PeerAcceptorListener extends ConnectionListener
{
    /**
     * Called when a connection has been accepted, before any message of it
     * is delivered. The handshake has not happened yet.
     */
    void onAccepted(PeerConnection connection);
}
