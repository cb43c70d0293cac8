package com.questrail.telerelay.core.relay;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.core.correlate.ResponseCorrelator;
import com.questrail.telerelay.core.latency.LatencyEstimate;
import com.questrail.telerelay.core.latency.LatencyEstimator;
import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.core.peer.PeerRegistry;
import com.questrail.telerelay.core.session.LatencyRecord;
import com.questrail.telerelay.core.session.SessionLog;
import com.questrail.telerelay.core.session.SessionState;
import com.questrail.telerelay.core.session.SessionStopReason;
import com.questrail.telerelay.core.session.SessionSummary;
import com.questrail.telerelay.observability.NullObservabilitySink;
import com.questrail.telerelay.observability.RelayCycleEvent;
import com.questrail.telerelay.observability.RelayErrorEvent;
import com.questrail.telerelay.observability.RelayObservabilitySink;
import com.questrail.telerelay.observability.SessionStateEvent;
import com.questrail.telerelay.protocol.model.Acknowledgement;
import com.questrail.telerelay.protocol.model.Command;
import com.questrail.telerelay.protocol.model.TelemetryPacket;
import com.questrail.telerelay.time.WallClock;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RelayLoop
 * =============================================================================
 * Per-packet relay state machine and sole owner of the {@link SessionLog}.
 *
 * <h2>Cycle</h2>
 * <pre>
 *   Idle
 *     │ TelemetryPacket
 *     ├── session inactive or no actuation peer ──► OBSERVED
 *     ▼
 *   Forwarded   (Command sent, t1 = packet send time)
 *     ├── acknowledgement within timeout ──► CORRELATED  (t4 = relay clock, record appended)
 *     └── no acknowledgement             ──► TIMED_OUT   (diagnostic only)
 * </pre>
 *
 * <h2>Single-flight</h2>
 * {@link #onTelemetry} is invoked from the measurement connection's reader
 * context and does not return before the cycle resolves, so at most one
 * command is outstanding. Every command carries a fresh request id that the
 * actuation agent echoes back.
 *
 * <h2>Session control</h2>
 * Start and stop take the same cycle lock as a forwarded cycle. Stopping a
 * session therefore never interrupts an outstanding wait; the stop takes
 * effect once the cycle has been correlated or has timed out.
 */
public final class RelayLoop
{
    private final PeerRegistry registry;
    private final ResponseCorrelator correlator;
    private final SessionLog sessionLog;
    private final PositionBoard positions;
    private final WallClock clock;
    private final RelayTimingPolicy timingPolicy;
    private final RelayObservabilitySink observabilitySink;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong nextRequestId = new AtomicLong(1);

    public RelayLoop(PeerRegistry registry,
                     ResponseCorrelator correlator,
                     SessionLog sessionLog,
                     PositionBoard positions,
                     WallClock clock,
                     RelayTimingPolicy timingPolicy,
                     RelayObservabilitySink observabilitySink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.sessionLog = Objects.requireNonNull(sessionLog, "sessionLog");
        this.positions = Objects.requireNonNull(positions, "positions");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Handle one telemetry packet from the current measurement connection.
     */
    public RelayCycleOutcome onTelemetry(TelemetryPacket packet)
    {
        Objects.requireNonNull(packet, "packet");
        positions.update(Role.MEASUREMENT, packet.position());

        cycleLock.lock();
        try {
            Optional<PeerConnection> actuation = registry.current(Role.ACTUATION);
            if (!sessionLog.isActive() || actuation.isEmpty()) {
                return RelayCycleOutcome.OBSERVED;
            }

            long requestId = nextRequestId.getAndIncrement();
            Command command = packet.toCommand(requestId);
            PeerConnection actuator = actuation.get();
            try {
                actuator.send(command);
            } catch (ConnectionLostException e) {
                observabilitySink.onError(new RelayErrorEvent(clock.now(),
                        "Could not forward command " + requestId + " to actuation peer", e));
                return emit(requestId, RelayCycleOutcome.SEND_FAILED, null, null);
            }
            sessionLog.recordAttempt(String.valueOf(actuator.remoteAddress()));

            final Optional<Acknowledgement> ack;
            try {
                ack = correlator.awaitResponse(requestId, timingPolicy.responseTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return emit(requestId, RelayCycleOutcome.ABANDONED, null, null);
            }
            double t4 = clock.nowEpochSeconds();

            if (ack.isEmpty()) {
                sessionLog.recordTimeout();
                return emit(requestId, RelayCycleOutcome.TIMED_OUT, null, null);
            }

            Acknowledgement a = ack.get();
            LatencyEstimate estimate = LatencyEstimator.estimate(
                    packet.sendTime(), a.receiptTime(), a.replySendTime(), t4);
            LatencyRecord record = sessionLog.append(requestId, packet, a, estimate);
            return emit(requestId, RelayCycleOutcome.CORRELATED, record, estimate);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Arm a new session, discarding the previous log and any queued acknowledgements.
     */
    public void startSession()
    {
        cycleLock.lock();
        try {
            SessionState before = sessionLog.state();
            correlator.clear();
            sessionLog.start();
            observabilitySink.onSessionEvent(new SessionStateEvent(
                    clock.now(), before, SessionState.ACTIVE, Optional.empty(), 0));
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Finalize the active session. A no-op returning empty if none is active.
     */
    public Optional<SessionSummary> stopSession(SessionStopReason reason)
    {
        cycleLock.lock();
        try {
            Optional<SessionSummary> summary = sessionLog.stop(reason);
            summary.ifPresent(s -> observabilitySink.onSessionEvent(new SessionStateEvent(
                    clock.now(), SessionState.ACTIVE, SessionState.INACTIVE, Optional.of(reason), s.records().size())));
            return summary;
        } finally {
            cycleLock.unlock();
        }
    }

    public SessionLog sessionLog()
    {
        return sessionLog;
    }

    private RelayCycleOutcome emit(long requestId,
                                   RelayCycleOutcome outcome,
                                   LatencyRecord record,
                                   LatencyEstimate estimate)
    {
        observabilitySink.onCycleEvent(new RelayCycleEvent(
                clock.now(), requestId, outcome, Optional.ofNullable(record), Optional.ofNullable(estimate)));
        return outcome;
    }
}
