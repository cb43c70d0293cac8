package com.questrail.telerelay.transport;

import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.protocol.model.RelayMessage;

/**
 * ConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for one peer connection.
 *
 * <p>Callbacks for a given connection are delivered serially, in arrival
 * order, on that connection's reader context. Different connections may be
 * served by different threads.</p>
 */
public interface ConnectionListener
{
    /**
     * Called for every decoded message.
     *
     * <p>Throwing {@link com.questrail.telerelay.protocol.codec.MalformedMessageException}
     * (or any other runtime exception) terminates the connection; the
     * exception is then reported as the cause in {@link #onClosed}.</p>
     */
    void onMessage(PeerConnection connection, RelayMessage message);

    /**
     * Called exactly once when the connection is gone.
     *
     * @param cause the failure that terminated the connection; {@code null}
     *              for an orderly close by either side
     */
    void onClosed(PeerConnection connection, Throwable cause);
}
