package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.GeoPosition;

import java.io.IOException;
import java.util.Optional;

/**
 * A positioning receiver that can be asked for a fix.
 */
public interface PositionSource
{
    /**
     * @return the current fix, or empty if the receiver has no lock
     * @throws IOException if the receiver is unreachable
     */
    Optional<GeoPosition> acquire() throws IOException;
}
