package com.questrail.telerelay.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Role
 * -----------------------------------------------------------------------------
 * The peer slot a connection occupies on the relay.
 *
 * <p>A role is fixed at registration. The relay holds at most one live
 * connection per role.</p>
 */
public enum Role
{
    /** The agent that samples voltage and position and sends telemetry. */
    MEASUREMENT("measurement"),

    /** The agent that applies forwarded commands and acknowledges them. */
    ACTUATION("actuation");

    private final String wireName;

    Role(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Name used for this role in {@code hello} messages.
     */
    public String wireName()
    {
        return wireName;
    }

    public static Optional<Role> fromWireName(String name)
    {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.wireName.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
