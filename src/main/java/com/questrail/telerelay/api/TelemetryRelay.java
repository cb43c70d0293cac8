package com.questrail.telerelay.api;

import com.questrail.telerelay.core.session.SessionSummary;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * TelemetryRelay
 * -----------------------------------------------------------------------------
 * Operator-facing control surface of the relay.
 *
 * <h2>Sessions</h2>
 * A session is the window during which forwarded commands produce latency
 * records. Starting a session discards the previous session's records;
 * starting while one is active restarts it. Stopping finalizes the session
 * and publishes its report.
 *
 * <h2>Asynchrony</h2>
 * Session changes are serialized on one control thread and take effect
 * between relay cycles, never in the middle of one. The returned futures
 * complete once the change has been applied.
 */
public interface TelemetryRelay
{
    /**
     * Begin (or restart) a logging session.
     */
    CompletableFuture<Void> startSession();

    /**
     * End the active session.
     *
     * @return the finalized session, or empty if no session was active
     */
    CompletableFuture<Optional<SessionSummary>> stopSession();

    RelayStatus status();
}
