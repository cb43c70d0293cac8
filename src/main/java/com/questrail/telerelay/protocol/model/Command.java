package com.questrail.telerelay.protocol.model;

import java.util.Objects;

/**
 * Instruction forwarded to the actuation agent.
 *
 * @param requestId monotonically increasing identifier, echoed in the acknowledgement
 * @param voltage   voltage to apply
 * @param status    quality of the originating sample
 */
public record Command(long requestId, double voltage, DataStatus status) implements RelayMessage
{
    public Command
    {
        Objects.requireNonNull(status, "status");
    }
}
