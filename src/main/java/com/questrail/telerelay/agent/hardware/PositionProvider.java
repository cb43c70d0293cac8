package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.GeoPosition;

import java.util.Optional;

/**
 * Last known position of the local agent. Never blocks.
 */
public interface PositionProvider
{
    Optional<GeoPosition> latestFix();
}
