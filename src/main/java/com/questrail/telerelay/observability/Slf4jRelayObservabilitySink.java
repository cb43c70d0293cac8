package com.questrail.telerelay.observability;

import com.questrail.telerelay.core.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onPeerEvent(PeerStateEvent event) {
        switch (event.kind()) {
            case ACCEPTED -> log.info("{} peer connection accepted from {}", event.role(), event.remote());
            case REGISTERED -> log.info("{} peer {} identified as '{}'",
                event.role(), event.remote(), event.agentId().orElse("?"));
            case REPLACED -> log.warn("{} peer {} replaced by a newer connection", event.role(), event.remote());
            case LOST -> {
                if (event.cause() != null) {
                    log.warn("{} peer {} lost: {}", event.role(), event.remote(), event.cause().toString());
                } else {
                    log.info("{} peer {} disconnected", event.role(), event.remote());
                }
            }
            case DISCARDED -> log.debug("{} connection {} closed (not current)", event.role(), event.remote());
        }
    }

    @Override
    public void onSessionEvent(SessionStateEvent event) {
        if (event.isRestart()) {
            log.info("Session restarted; previous log discarded");
        } else if (event.newState() == SessionState.ACTIVE) {
            log.info("Session started");
        } else {
            log.info("Session stopped ({}), {} records",
                event.stopReason().map(Enum::name).orElse("?"), event.recordCount());
        }
    }

    @Override
    public void onCycleEvent(RelayCycleEvent event) {
        switch (event.outcome()) {
            case CORRELATED -> event.record().ifPresent(r -> {
                if (r.delayMillis() < 0.0) {
                    log.warn("Logged packet #{} with negative delay {} ms (asymmetric transit)",
                        r.sequence(), String.format("%.2f", r.delayMillis()));
                } else {
                    log.info("Logged packet #{}, delay {} ms", r.sequence(), String.format("%.2f", r.delayMillis()));
                }
            });
            case TIMED_OUT -> log.warn("Timed out waiting for actuation acknowledgement of request {}", event.requestId());
            case SEND_FAILED -> log.warn("Request {} not forwarded: actuation channel unavailable", event.requestId());
            case ABANDONED -> log.info("Request {} abandoned", event.requestId());
            case OBSERVED -> log.trace("Telemetry observed without forwarding");
        }
    }

    @Override
    public void onError(RelayErrorEvent event) {
        log.error("Relay error: {}", event.message(), event.cause());
    }
}
