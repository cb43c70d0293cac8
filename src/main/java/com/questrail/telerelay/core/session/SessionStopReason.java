package com.questrail.telerelay.core.session;

/**
 * Why a session was finalized.
 */
public enum SessionStopReason
{
    /** Explicit stop command. */
    OPERATOR_REQUEST,

    /** The current measurement connection closed or failed. */
    MEASUREMENT_PEER_LOST,

    /** The current actuation connection closed or failed. */
    ACTUATION_PEER_LOST,

    /** The relay is shutting down. */
    SHUTDOWN
}
