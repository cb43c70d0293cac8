package com.questrail.telerelay.core.session;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Finalized session handed to the report sinks.
 *
 * @param startedAt       when the session was armed
 * @param stoppedAt       when it was finalized
 * @param stopReason      why it was finalized
 * @param actuationPeer   address of the actuation agent commands were sent to, if any
 * @param records         ordered latency records
 * @param delaySamplesMs  raw delay samples, one per record
 * @param cyclesAttempted commands forwarded while the session was active
 * @param cyclesTimedOut  forwarded commands that were never acknowledged in time
 */
public record SessionSummary(
        Instant startedAt,
        Instant stoppedAt,
        SessionStopReason stopReason,
        Optional<String> actuationPeer,
        List<LatencyRecord> records,
        List<Double> delaySamplesMs,
        long cyclesAttempted,
        long cyclesTimedOut
) {
    public SessionSummary {
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(stoppedAt, "stoppedAt");
        Objects.requireNonNull(stopReason, "stopReason");
        Objects.requireNonNull(actuationPeer, "actuationPeer");
        records = List.copyOf(records);
        delaySamplesMs = List.copyOf(delaySamplesMs);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Mean corrected delay in milliseconds; {@code 0.0} for an empty session.
     */
    public double meanDelayMs() {
        return delaySamplesMs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public OptionalDouble minDelayMs() {
        return delaySamplesMs.stream().mapToDouble(Double::doubleValue).min();
    }

    public OptionalDouble maxDelayMs() {
        return delaySamplesMs.stream().mapToDouble(Double::doubleValue).max();
    }
}
