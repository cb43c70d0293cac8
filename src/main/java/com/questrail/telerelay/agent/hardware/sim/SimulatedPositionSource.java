package com.questrail.telerelay.agent.hardware.sim;

import com.questrail.telerelay.agent.hardware.PositionSource;
import com.questrail.telerelay.protocol.model.GeoPosition;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Random walk around a starting point, a few metres per poll.
 */
public final class SimulatedPositionSource implements PositionSource
{
    private static final double STEP_DEGREES = 0.00003;

    private final Random random;
    private double latitude;
    private double longitude;

    public SimulatedPositionSource(GeoPosition start, Random random)
    {
        Objects.requireNonNull(start, "start");
        this.random = Objects.requireNonNull(random, "random");
        this.latitude = start.latitude();
        this.longitude = start.longitude();
    }

    @Override
    public synchronized Optional<GeoPosition> acquire()
    {
        latitude = clamp(latitude + (random.nextDouble() - 0.5) * STEP_DEGREES, -90, 90);
        longitude = clamp(longitude + (random.nextDouble() - 0.5) * STEP_DEGREES, -180, 180);
        return Optional.of(new GeoPosition(latitude, longitude));
    }

    private static double clamp(double v, double min, double max)
    {
        return Math.max(min, Math.min(max, v));
    }
}
