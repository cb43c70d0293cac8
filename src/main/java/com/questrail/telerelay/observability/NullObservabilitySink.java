package com.questrail.telerelay.observability;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPeerEvent(PeerStateEvent event) {}

    @Override
    public void onSessionEvent(SessionStateEvent event) {}

    @Override
    public void onCycleEvent(RelayCycleEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
