package com.questrail.telerelay.agent.hardware;

/**
 * Raw digital-to-analog converter output.
 */
public interface DacOutput
{
    /**
     * Full-scale code of the converter (65535 for a 16-bit interface).
     */
    int maxCode();

    void write(int code);
}
