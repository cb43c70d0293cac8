package com.questrail.telerelay.agent.hardware;

/**
 * Produces classified voltage samples for the measurement agent.
 *
 * <p>Implementations never throw: a failed read is reported as a
 * {@link com.questrail.telerelay.protocol.model.DataStatus#JUNK JUNK} sample.</p>
 */
public interface VoltageSensor
{
    SensorReading read();
}
