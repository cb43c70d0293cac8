package com.questrail.telerelay.observability;

import com.questrail.telerelay.core.session.SessionState;
import com.questrail.telerelay.core.session.SessionStopReason;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a session transition.
 */
public record SessionStateEvent(
    Instant timestamp,
    SessionState oldState,
    SessionState newState,
    Optional<SessionStopReason> stopReason,
    int recordCount
) {
    /**
     * Whether an already active session was restarted (its log discarded).
     */
    public boolean isRestart() {
        return oldState == SessionState.ACTIVE && newState == SessionState.ACTIVE;
    }
}
