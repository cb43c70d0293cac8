package com.questrail.telerelay.core.peer;

/**
 * Raised when a peer channel is closed or reset while it is being used.
 */
public final class ConnectionLostException extends RuntimeException
{
    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
