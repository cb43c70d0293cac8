package com.questrail.telerelay.core.relay;

/**
 * How one telemetry packet was handled by the {@link RelayLoop}.
 */
public enum RelayCycleOutcome
{
    /** No active session or no actuation peer: packet observed, nothing forwarded. */
    OBSERVED,

    /** Command forwarded, acknowledgement matched, record appended. */
    CORRELATED,

    /** Command forwarded, no acknowledgement within the response timeout. */
    TIMED_OUT,

    /** The actuation channel was gone when the command was sent. */
    SEND_FAILED,

    /** The wait was interrupted (relay shutting down). */
    ABANDONED
}
