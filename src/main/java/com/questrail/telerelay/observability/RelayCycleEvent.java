package com.questrail.telerelay.observability;

import com.questrail.telerelay.core.latency.LatencyEstimate;
import com.questrail.telerelay.core.relay.RelayCycleOutcome;
import com.questrail.telerelay.core.session.LatencyRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing the result of one forwarded telemetry packet.
 *
 * <p>{@code record} and {@code estimate} are present only for
 * {@link RelayCycleOutcome#CORRELATED}.</p>
 */
public record RelayCycleEvent(
    Instant timestamp,
    long requestId,
    RelayCycleOutcome outcome,
    Optional<LatencyRecord> record,
    Optional<LatencyEstimate> estimate
) {
}
