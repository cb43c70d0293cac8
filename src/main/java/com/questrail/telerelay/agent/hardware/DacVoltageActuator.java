package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.DataStatus;

import java.util.Objects;

/**
 * {@link VoltageActuator} over a DAC with a fixed reference voltage.
 *
 * <p>The output code is {@code (int) (voltage / vRef * maxCode)}, clamped to
 * {@code [0, maxCode]}. Junk commands drive 0 V. The returned voltage is the
 * one the clamped code produces.</p>
 */
public final class DacVoltageActuator implements VoltageActuator
{
    public static final double DEFAULT_REFERENCE_VOLTS = 3.3;

    private final DacOutput dac;
    private final double referenceVolts;

    public DacVoltageActuator(DacOutput dac)
    {
        this(dac, DEFAULT_REFERENCE_VOLTS);
    }

    public DacVoltageActuator(DacOutput dac, double referenceVolts)
    {
        this.dac = Objects.requireNonNull(dac, "dac");
        if (!(referenceVolts > 0) || Double.isInfinite(referenceVolts)) {
            throw new IllegalArgumentException("referenceVolts must be positive");
        }
        this.referenceVolts = referenceVolts;
    }

    @Override
    public double apply(double voltage, DataStatus status)
    {
        Objects.requireNonNull(status, "status");
        if (!status.isProper() || !Double.isFinite(voltage)) {
            reset();
            return 0.0;
        }

        int code = codeFor(voltage);
        dac.write(code);
        return code * referenceVolts / dac.maxCode();
    }

    @Override
    public void reset()
    {
        dac.write(0);
    }

    int codeFor(double voltage)
    {
        int max = dac.maxCode();
        long raw = (long) (voltage / referenceVolts * max);
        return (int) Math.max(0, Math.min(max, raw));
    }
}
