package com.questrail.telerelay.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Settable wall clock for tests. Time only changes when told to.
 */
public final class ManualWallClock implements WallClock {

    private volatile Instant now;

    public ManualWallClock(Instant start) {
        this.now = Objects.requireNonNull(start, "start");
    }

    public static ManualWallClock atEpochSeconds(double epochSeconds) {
        return new ManualWallClock(WallClock.fromEpochSeconds(epochSeconds));
    }

    @Override
    public Instant now() {
        return now;
    }

    public void set(Instant instant) {
        this.now = Objects.requireNonNull(instant, "instant");
    }

    public void setEpochSeconds(double epochSeconds) {
        set(WallClock.fromEpochSeconds(epochSeconds));
    }

    public void advanceMillis(long millis) {
        now = now.plusMillis(millis);
    }
}
