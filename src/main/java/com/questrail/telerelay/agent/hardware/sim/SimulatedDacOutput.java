package com.questrail.telerelay.agent.hardware.sim;

import com.questrail.telerelay.agent.hardware.DacOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 16-bit DAC that only remembers and logs the last written code.
 */
public final class SimulatedDacOutput implements DacOutput
{
    private static final Logger log = LoggerFactory.getLogger(SimulatedDacOutput.class);

    public static final int MAX_CODE = 65535;

    private volatile int lastCode;

    @Override
    public int maxCode()
    {
        return MAX_CODE;
    }

    @Override
    public void write(int code)
    {
        if (code < 0 || code > MAX_CODE) {
            throw new IllegalArgumentException("code out of range: " + code);
        }
        lastCode = code;
        log.debug("DAC <- {}", code);
    }

    public int lastCode()
    {
        return lastCode;
    }
}
