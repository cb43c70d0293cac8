package com.questrail.telerelay.protocol.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * The actuation agent's report of what it did with one {@link Command}.
 *
 * <p>Agents that predate request identifiers omit {@code requestId}; such
 * acknowledgements can only be matched by arrival order.</p>
 *
 * @param requestId      echoed command identifier, if the agent supplies one
 * @param receiptTime    {@code t2}: actuation agent wall clock when the command arrived
 * @param replySendTime  {@code t3}: actuation agent wall clock when this reply was sent
 * @param appliedVoltage voltage actually applied, if reported
 * @param position       most recent position fix of the actuation agent, if any
 */
public record Acknowledgement(
        OptionalLong requestId,
        double receiptTime,
        double replySendTime,
        OptionalDouble appliedVoltage,
        Optional<GeoPosition> position
) implements RelayMessage
{
    public Acknowledgement
    {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(appliedVoltage, "appliedVoltage");
        Objects.requireNonNull(position, "position");
    }
}
