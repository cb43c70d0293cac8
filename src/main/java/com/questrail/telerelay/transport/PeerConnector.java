package com.questrail.telerelay.transport;

import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;

/**
 * PeerConnector
 * -----------------------------------------------------------------------------
 * Agent-side endpoint that opens a connection to the relay.
 */
public interface PeerConnector
{
    /**
     * Open a connection, blocking until it is established.
     *
     * @param listener receives the relay's messages and the close notification
     * @return the open connection
     * @throws ConnectionLostException if the relay cannot be reached
     */
    PeerConnection connect(ConnectionListener listener);

    /**
     * Release transport resources. Open connections are closed.
     */
    void shutdown();
}
