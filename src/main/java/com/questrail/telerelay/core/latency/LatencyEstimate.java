package com.questrail.telerelay.core.latency;

/**
 * Result of one four-timestamp latency estimate. All times are epoch seconds.
 *
 * @param offset              estimated clock offset of the actuation agent relative to the measurement agent
 * @param correctedReceiptTime {@code t2} shifted onto the measurement agent's clock
 * @param delaySeconds        corrected one-way delay
 */
public record LatencyEstimate(double offset, double correctedReceiptTime, double delaySeconds)
{
    public double delayMillis()
    {
        return delaySeconds * 1000.0;
    }

    /**
     * A negative delay means the equal-transit assumption did not hold for
     * this sample. The value is kept as computed; callers may flag it.
     */
    public boolean isNegative()
    {
        return delaySeconds < 0.0;
    }
}
