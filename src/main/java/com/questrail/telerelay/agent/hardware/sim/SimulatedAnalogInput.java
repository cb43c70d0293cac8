package com.questrail.telerelay.agent.hardware.sim;

import com.questrail.telerelay.agent.hardware.AnalogInput;
import com.questrail.telerelay.time.MonotonicClock;

import java.util.Objects;
import java.util.Random;

/**
 * Slow sine wave between 0.5 V and 2.5 V with occasional probe dropouts
 * (samples near 0 V).
 */
public final class SimulatedAnalogInput implements AnalogInput
{
    private static final double PERIOD_SECONDS = 20.0;

    private final MonotonicClock clock;
    private final Random random;
    private final double dropoutProbability;
    private final long originNanos;

    public SimulatedAnalogInput(MonotonicClock clock, Random random, double dropoutProbability)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
        if (dropoutProbability < 0 || dropoutProbability > 1) {
            throw new IllegalArgumentException("dropoutProbability must be within [0, 1]");
        }
        this.dropoutProbability = dropoutProbability;
        this.originNanos = clock.nowNanos();
    }

    @Override
    public synchronized double readVolts()
    {
        if (random.nextDouble() < dropoutProbability) {
            return random.nextDouble() * 0.05;
        }
        double seconds = (clock.nowNanos() - originNanos) / 1e9;
        double noise = (random.nextDouble() - 0.5) * 0.02;
        return 1.5 + Math.sin(2 * Math.PI * seconds / PERIOD_SECONDS) + noise;
    }
}
