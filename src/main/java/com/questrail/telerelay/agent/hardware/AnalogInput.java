package com.questrail.telerelay.agent.hardware;

import java.io.IOException;

/**
 * Raw single-channel analog input (an ADC channel).
 */
public interface AnalogInput
{
    /**
     * @return the sampled voltage in volts
     * @throws IOException if the converter could not be read
     */
    double readVolts() throws IOException;
}
