package com.questrail.telerelay.protocol.model;

import java.util.Optional;

/**
 * Quality of a voltage sample.
 *
 * <p>Measurement agents label usable samples {@code "Proper"}. Every other
 * sample is junk; agents append a reason in parentheses (for example
 * {@code "Junk (Disconnected)"}), which the relay accepts but does not keep.</p>
 */
public enum DataStatus
{
    PROPER("Proper"),
    JUNK("Junk");

    private final String label;

    DataStatus(String label)
    {
        this.label = label;
    }

    public String label()
    {
        return label;
    }

    public boolean isProper()
    {
        return this == PROPER;
    }

    public static Optional<DataStatus> fromLabel(String label)
    {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        if (trimmed.equals(PROPER.label)) {
            return Optional.of(PROPER);
        }
        if (trimmed.startsWith(JUNK.label)) {
            return Optional.of(JUNK);
        }
        return Optional.empty();
    }
}
