package com.questrail.telerelay.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for agent cadence, reconnect backoff and position polling.
 *
 * <h2>Binding invariant</h2>
 * Scheduling decisions MUST use a monotonic time source. Wall-clock time is
 * reserved for the latency timestamps exchanged on the wire (see
 * {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
