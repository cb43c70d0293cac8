package com.questrail.telerelay.core.relay;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.protocol.model.GeoPosition;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known position of each agent, for map and status consumers.
 *
 * <p>A message without a fix leaves the previous fix in place.</p>
 */
public final class PositionBoard
{
    private final Map<Role, GeoPosition> latest = new ConcurrentHashMap<>();

    public void update(Role role, Optional<GeoPosition> position)
    {
        Objects.requireNonNull(role, "role");
        position.ifPresent(p -> latest.put(role, p));
    }

    public Optional<GeoPosition> latest(Role role)
    {
        return Optional.ofNullable(latest.get(role));
    }

    public void forget(Role role)
    {
        latest.remove(role);
    }
}
