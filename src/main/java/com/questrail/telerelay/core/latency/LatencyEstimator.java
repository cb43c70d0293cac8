package com.questrail.telerelay.core.latency;

/**
 * LatencyEstimator
 * =============================================================================
 * Symmetric clock-offset estimator over four wall-clock timestamps taken on
 * three unsynchronized machines.
 *
 * <pre>
 *   t1  measurement agent sends the telemetry packet   (measurement clock)
 *   t2  actuation agent receives the command          (actuation clock)
 *   t3  actuation agent sends the acknowledgement     (actuation clock)
 *   t4  relay receives the acknowledgement            (relay clock)
 *
 *   offset        = ((t2 - t1) + (t3 - t4)) / 2
 *   corrected t2  = t2 - offset
 *   one-way delay = corrected t2 - t1
 * </pre>
 *
 * <p>Assuming equal forward and return transit time, the unknown offset of the
 * actuation clock cancels out of the delay. When that assumption is violated
 * the delay may be negative or implausible; it is returned unchanged.</p>
 *
 * <p>Pure and stateless.</p>
 */
public final class LatencyEstimator
{
    private LatencyEstimator() {}

    public static LatencyEstimate estimate(double t1, double t2, double t3, double t4)
    {
        double offset = ((t2 - t1) + (t3 - t4)) / 2.0;
        double correctedT2 = t2 - offset;
        return new LatencyEstimate(offset, correctedT2, correctedT2 - t1);
    }
}
