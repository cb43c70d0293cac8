package com.questrail.telerelay.core.session;

import com.questrail.telerelay.protocol.model.DataStatus;
import com.questrail.telerelay.protocol.model.GeoPosition;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One completed relay cycle.
 *
 * @param sequence             dense 1-based position in the session log
 * @param requestId            identifier of the forwarded command
 * @param sendTime             {@code t1}, epoch seconds
 * @param correctedReceiptTime corrected {@code t2}, epoch seconds
 * @param delayMillis          corrected one-way delay
 * @param measuredVoltage      voltage reported by the measurement agent
 * @param status               sample quality
 * @param appliedVoltage       voltage the actuation agent applied, if reported
 * @param measurementPosition  measurement agent position at send time
 * @param actuationPosition    actuation agent position in the acknowledgement
 */
public record LatencyRecord(
        int sequence,
        long requestId,
        double sendTime,
        double correctedReceiptTime,
        double delayMillis,
        double measuredVoltage,
        DataStatus status,
        OptionalDouble appliedVoltage,
        Optional<GeoPosition> measurementPosition,
        Optional<GeoPosition> actuationPosition
) {
    public LatencyRecord {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(appliedVoltage, "appliedVoltage");
        Objects.requireNonNull(measurementPosition, "measurementPosition");
        Objects.requireNonNull(actuationPosition, "actuationPosition");
    }
}
