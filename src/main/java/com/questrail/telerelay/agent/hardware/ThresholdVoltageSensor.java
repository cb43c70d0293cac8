package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.DataStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Classifies analog samples by a minimum plausible voltage.
 *
 * <p>A sample at or below the threshold means the probe is disconnected and is
 * reported as {@link DataStatus#JUNK} with its raw value. A read failure
 * yields {@link SensorReading#junk()}.</p>
 */
public final class ThresholdVoltageSensor implements VoltageSensor
{
    private static final Logger log = LoggerFactory.getLogger(ThresholdVoltageSensor.class);

    public static final double DEFAULT_THRESHOLD_VOLTS = 0.1;

    private final AnalogInput input;
    private final double thresholdVolts;

    public ThresholdVoltageSensor(AnalogInput input)
    {
        this(input, DEFAULT_THRESHOLD_VOLTS);
    }

    public ThresholdVoltageSensor(AnalogInput input, double thresholdVolts)
    {
        this.input = Objects.requireNonNull(input, "input");
        if (!Double.isFinite(thresholdVolts) || thresholdVolts < 0) {
            throw new IllegalArgumentException("thresholdVolts must be finite and >= 0");
        }
        this.thresholdVolts = thresholdVolts;
    }

    @Override
    public SensorReading read()
    {
        double volts;
        try {
            volts = input.readVolts();
        } catch (IOException e) {
            log.warn("Analog read failed: {}", e.getMessage());
            return SensorReading.junk();
        }
        if (!Double.isFinite(volts)) {
            log.warn("Analog input returned {}", volts);
            return SensorReading.junk();
        }
        return new SensorReading(volts, volts > thresholdVolts ? DataStatus.PROPER : DataStatus.JUNK);
    }
}
