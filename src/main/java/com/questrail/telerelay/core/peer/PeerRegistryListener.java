package com.questrail.telerelay.core.peer;

import com.questrail.telerelay.api.Role;

/**
 * Observer of {@link PeerRegistry} changes.
 *
 * <p>Callbacks run on the thread that changed the registry and must not block.</p>
 */
public interface PeerRegistryListener
{
    /**
     * A connection became the current one for {@code role}.
     *
     * @param replaced the connection it displaced, or {@code null}
     */
    void onRegistered(Role role, PeerConnection connection, PeerConnection replaced);

    /**
     * The current connection for {@code role} was removed.
     */
    void onCleared(Role role, PeerConnection connection);
}
