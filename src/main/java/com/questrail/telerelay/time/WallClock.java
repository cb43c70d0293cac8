package com.questrail.telerelay.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for the four latency timestamps.
 *
 * <p>The relay, the measurement agent and the actuation agent each read their
 * own wall clock. Those clocks are not synchronized; the latency estimator
 * cancels the unknown offset between them. This clock may jump (NTP, manual
 * adjustment) and MUST NOT be used for timeouts or cadence.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns the current wall-clock time as fractional seconds since the
     * epoch, the unit carried by the wire protocol.
     */
    default double nowEpochSeconds()
    {
        return toEpochSeconds(now());
    }

    static double toEpochSeconds(Instant instant)
    {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    static Instant fromEpochSeconds(double epochSeconds)
    {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000.0);
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
