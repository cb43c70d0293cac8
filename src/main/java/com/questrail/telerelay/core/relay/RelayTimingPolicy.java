package com.questrail.telerelay.core.relay;

import java.time.Duration;
import java.util.Objects;

/**
 * RelayTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the relay.
 *
 * <ul>
 *   <li><b>responseTimeout</b>: how long one relay cycle waits for the
 *       actuation acknowledgement before the cycle is skipped.</li>
 *   <li><b>shutdownGrace</b>: how long {@code stop()} waits for in-flight work
 *       (an outstanding cycle, report publication) before forcing shutdown.</li>
 * </ul>
 */
public record RelayTimingPolicy(
        Duration responseTimeout,
        Duration shutdownGrace
) {
    public RelayTimingPolicy {
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");

        if (responseTimeout.isNegative() || responseTimeout.isZero()) {
            throw new IllegalArgumentException("responseTimeout must be positive");
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must be non-negative");
        }
    }

    public static RelayTimingPolicy withResponseTimeout(Duration responseTimeout) {
        return new RelayTimingPolicy(responseTimeout, defaults().shutdownGrace());
    }

    /**
     * Defaults: 2000 ms response timeout, 5 s shutdown grace.
     */
    public static RelayTimingPolicy defaults() {
        return new RelayTimingPolicy(Duration.ofMillis(2000), Duration.ofSeconds(5));
    }
}
