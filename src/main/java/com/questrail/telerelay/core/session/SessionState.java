package com.questrail.telerelay.core.session;

/**
 * Logging window state. Transitions: {@code INACTIVE -> ACTIVE} on start,
 * {@code ACTIVE -> ACTIVE} on restart (log cleared), {@code ACTIVE -> INACTIVE}
 * on stop.
 */
public enum SessionState
{
    INACTIVE,
    ACTIVE
}
