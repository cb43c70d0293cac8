package com.questrail.telerelay.core.session;

import com.questrail.telerelay.core.latency.LatencyEstimate;
import com.questrail.telerelay.protocol.model.Acknowledgement;
import com.questrail.telerelay.protocol.model.TelemetryPacket;
import com.questrail.telerelay.time.WallClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionLog
 * =============================================================================
 * Ordered, session-scoped accumulation of completed relay cycles.
 *
 * <h2>Sequencing</h2>
 * Sequence numbers are dense: the n-th appended record gets sequence n. A
 * cycle that timed out is counted in {@code cyclesTimedOut} but consumes no
 * sequence number, so the record count legitimately undercounts commands sent.
 *
 * <h2>Ownership</h2>
 * Only the relay loop mutates the log. Status and report consumers read
 * through {@link #records()}, {@link #size()} and {@link #state()}, which
 * return consistent snapshots. All methods synchronize on this instance.
 */
public final class SessionLog
{
    private final WallClock clock;

    private SessionState state = SessionState.INACTIVE;
    private Instant startedAt;
    private String actuationPeer;
    private final List<LatencyRecord> records = new ArrayList<>();
    private final List<Double> delaySamplesMs = new ArrayList<>();
    private long cyclesAttempted;
    private long cyclesTimedOut;

    public SessionLog(WallClock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Discard prior records, samples and counters and arm the session.
     * Calling start on an active session restarts it.
     */
    public synchronized void start()
    {
        records.clear();
        delaySamplesMs.clear();
        cyclesAttempted = 0;
        cyclesTimedOut = 0;
        actuationPeer = null;
        startedAt = clock.now();
        state = SessionState.ACTIVE;
    }

    /**
     * Count one forwarded command.
     */
    public synchronized void recordAttempt(String actuationPeerAddress)
    {
        requireActive();
        cyclesAttempted++;
        if (actuationPeerAddress != null) {
            actuationPeer = actuationPeerAddress;
        }
    }

    /**
     * Count one forwarded command that was not acknowledged in time.
     */
    public synchronized void recordTimeout()
    {
        requireActive();
        cyclesTimedOut++;
    }

    /**
     * Append the record of one correlated cycle.
     *
     * @return the appended record, carrying its sequence number
     * @throws IllegalStateException if the session is not active
     */
    public synchronized LatencyRecord append(long requestId,
                                             TelemetryPacket packet,
                                             Acknowledgement ack,
                                             LatencyEstimate estimate)
    {
        requireActive();
        Objects.requireNonNull(packet, "packet");
        Objects.requireNonNull(ack, "ack");
        Objects.requireNonNull(estimate, "estimate");

        LatencyRecord record = new LatencyRecord(
                records.size() + 1,
                requestId,
                packet.sendTime(),
                estimate.correctedReceiptTime(),
                estimate.delayMillis(),
                packet.voltage(),
                packet.status(),
                ack.appliedVoltage(),
                packet.position(),
                ack.position()
        );
        records.add(record);
        delaySamplesMs.add(record.delayMillis());
        return record;
    }

    /**
     * Disarm the session and finalize it.
     *
     * @return the summary, or empty if the session was not active
     */
    public synchronized Optional<SessionSummary> stop(SessionStopReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        if (state != SessionState.ACTIVE) {
            return Optional.empty();
        }
        state = SessionState.INACTIVE;
        return Optional.of(new SessionSummary(
                startedAt,
                clock.now(),
                reason,
                Optional.ofNullable(actuationPeer),
                records,
                delaySamplesMs,
                cyclesAttempted,
                cyclesTimedOut
        ));
    }

    public synchronized SessionState state()
    {
        return state;
    }

    public synchronized boolean isActive()
    {
        return state == SessionState.ACTIVE;
    }

    public synchronized int size()
    {
        return records.size();
    }

    public synchronized List<LatencyRecord> records()
    {
        return List.copyOf(records);
    }

    public synchronized List<Double> delaySamplesMs()
    {
        return List.copyOf(delaySamplesMs);
    }

    private void requireActive()
    {
        if (state != SessionState.ACTIVE) {
            throw new IllegalStateException("Session is not active");
        }
    }
}
