package com.questrail.telerelay.protocol.model;

import com.questrail.telerelay.api.Role;

import java.util.Objects;

/**
 * Identification sent by an agent immediately after connecting.
 *
 * @param agentId free-form agent name (for example {@code "sensor_pi"})
 * @param role    the role the agent claims
 */
public record Hello(String agentId, Role role) implements RelayMessage
{
    public Hello
    {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(role, "role");
    }
}
