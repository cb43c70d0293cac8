package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.DataStatus;

/**
 * Drives the controlled output of the actuation agent.
 */
public interface VoltageActuator
{
    /**
     * Apply a commanded voltage.
     *
     * @return the voltage actually driven
     */
    double apply(double voltage, DataStatus status);

    /**
     * Drive the safe state (0 V).
     */
    void reset();
}
