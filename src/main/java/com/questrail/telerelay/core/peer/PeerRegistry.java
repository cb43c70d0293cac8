package com.questrail.telerelay.core.peer;

import com.questrail.telerelay.api.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PeerRegistry
 * =============================================================================
 * Tracks at most one live {@link PeerConnection} per {@link Role}.
 *
 * <h2>Replacement</h2>
 * Registering a connection for an occupied role replaces the previous entry.
 * The displaced connection is closed so its socket does not leak, and its
 * later traffic is ignored because it is no longer {@link #isCurrent current}.
 *
 * <h2>Stale removal</h2>
 * {@link #clear(Role, PeerConnection)} only removes the entry if the given
 * connection is still the current one. A replaced connection that reports its
 * own disconnect therefore cannot evict its successor.
 *
 * <h2>Thread Safety</h2>
 * Entries are held in a concurrent map; mutations are atomic per role and
 * reads never block. Listeners are notified after the mutation took effect.
 */
public final class PeerRegistry
{
    private static final Logger log = LoggerFactory.getLogger(PeerRegistry.class);

    private final ConcurrentMap<Role, PeerConnection> connections = new ConcurrentHashMap<>();
    private final List<PeerRegistryListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(PeerRegistryListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Install {@code connection} as the current connection for {@code role}.
     *
     * @return the replaced connection, already closed, if there was one
     */
    public Optional<PeerConnection> register(Role role, PeerConnection connection)
    {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(connection, "connection");

        PeerConnection replaced = connections.put(role, connection);
        if (replaced == connection) {
            return Optional.empty();
        }
        if (replaced != null) {
            log.warn("Replacing {} peer {} with {}", role, replaced.remoteAddress(), connection.remoteAddress());
            replaced.close();
        }

        for (PeerRegistryListener l : listeners) {
            l.onRegistered(role, connection, replaced);
        }
        return Optional.ofNullable(replaced);
    }

    public Optional<PeerConnection> current(Role role)
    {
        return Optional.ofNullable(connections.get(Objects.requireNonNull(role, "role")));
    }

    public boolean isConnected(Role role)
    {
        return current(role).isPresent();
    }

    /**
     * Whether {@code connection} is the registered connection for its role.
     */
    public boolean isCurrent(PeerConnection connection)
    {
        return connection != null && connections.get(connection.role()) == connection;
    }

    /**
     * Remove {@code connection} if it is still the current one for {@code role}.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean clear(Role role, PeerConnection connection)
    {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(connection, "connection");

        if (!connections.remove(role, connection)) {
            return false;
        }
        for (PeerRegistryListener l : listeners) {
            l.onCleared(role, connection);
        }
        return true;
    }

    /**
     * Close and remove every registered connection.
     */
    public void closeAll()
    {
        for (Role role : Role.values()) {
            PeerConnection c = connections.get(role);
            if (c != null && clear(role, c)) {
                c.close();
            }
        }
    }
}
