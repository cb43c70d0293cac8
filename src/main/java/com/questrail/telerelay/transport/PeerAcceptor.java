package com.questrail.telerelay.transport;

import com.questrail.telerelay.api.Role;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * PeerAcceptor
 * -----------------------------------------------------------------------------
 * Listening endpoint for the agents of one {@link Role}.
 *
 * <p>The acceptor keeps accepting for as long as it runs; a failed or closed
 * connection never stops it, so a replacement agent can always reconnect.</p>
 */
public interface PeerAcceptor
{
    Role role();

    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(PeerAcceptorListener listener);

    /**
     * Bind and begin accepting connections.
     *
     * @throws IllegalStateException if the listening socket cannot be bound
     */
    void start();

    /**
     * Close the listening socket and every accepted connection.
     */
    void stop();

    /**
     * The bound local address, once started.
     */
    Optional<SocketAddress> localAddress();
}
