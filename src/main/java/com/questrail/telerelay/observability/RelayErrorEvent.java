package com.questrail.telerelay.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the relay.
 */
public record RelayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
