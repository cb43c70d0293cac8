package com.questrail.telerelay.observability;

/**
 * Main interface for receiving relay observability events.
 * Implementations can provide logging, metrics, or status display.
 */
public interface RelayObservabilitySink {
    /**
     * Called when a peer connects, is replaced, or is lost.
     * @param event the peer event
     */
    void onPeerEvent(PeerStateEvent event);

    /**
     * Called when a session is started, restarted or stopped.
     * @param event the transition details
     */
    void onSessionEvent(SessionStateEvent event);

    /**
     * Called once per forwarded telemetry packet (correlated, timed out, ...).
     * @param event the cycle result
     */
    void onCycleEvent(RelayCycleEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(RelayErrorEvent event);
}
