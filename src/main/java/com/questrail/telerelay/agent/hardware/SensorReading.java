package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.DataStatus;

import java.util.Objects;

/**
 * One classified voltage sample.
 */
public record SensorReading(double voltage, DataStatus status) {
    public SensorReading {
        Objects.requireNonNull(status, "status");
        if (!Double.isFinite(voltage)) {
            throw new IllegalArgumentException("voltage must be finite");
        }
    }

    public static SensorReading junk() {
        return new SensorReading(0.0, DataStatus.JUNK);
    }
}
