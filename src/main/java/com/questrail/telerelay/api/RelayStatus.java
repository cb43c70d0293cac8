package com.questrail.telerelay.api;

import com.questrail.telerelay.core.session.SessionState;
import com.questrail.telerelay.protocol.model.GeoPosition;

import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time view of the relay, as shown to an operator.
 *
 * @param measurementPeer remote address of the current measurement agent
 * @param actuationPeer   remote address of the current actuation agent
 * @param recordCount     latency records in the current (or last) session
 */
public record RelayStatus(
        Optional<String> measurementPeer,
        Optional<String> actuationPeer,
        SessionState sessionState,
        int recordCount,
        Optional<GeoPosition> measurementPosition,
        Optional<GeoPosition> actuationPosition
) {
    public RelayStatus {
        Objects.requireNonNull(measurementPeer, "measurementPeer");
        Objects.requireNonNull(actuationPeer, "actuationPeer");
        Objects.requireNonNull(sessionState, "sessionState");
        Objects.requireNonNull(measurementPosition, "measurementPosition");
        Objects.requireNonNull(actuationPosition, "actuationPosition");
    }

    public boolean measurementConnected() {
        return measurementPeer.isPresent();
    }

    public boolean actuationConnected() {
        return actuationPeer.isPresent();
    }

    /**
     * Whether a started session would produce records right away.
     */
    public boolean readyToRelay() {
        return measurementConnected() && actuationConnected();
    }
}
