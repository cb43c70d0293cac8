package com.questrail.telerelay.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One measurement sample.
 *
 * @param voltage  sampled voltage
 * @param status   sample quality
 * @param position most recent position fix of the measurement agent, if any
 * @param sendTime {@code t1}: measurement agent wall clock at send, epoch seconds
 */
public record TelemetryPacket(
        double voltage,
        DataStatus status,
        Optional<GeoPosition> position,
        double sendTime
) implements RelayMessage
{
    public TelemetryPacket
    {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(position, "position");
    }

    /**
     * Derives the command forwarded to the actuation agent for this sample.
     */
    public Command toCommand(long requestId)
    {
        return new Command(requestId, voltage, status);
    }
}
