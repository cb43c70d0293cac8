package com.questrail.telerelay.agent;

import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.core.peer.ConnectionLostException;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.protocol.model.Hello;
import com.questrail.telerelay.time.Cancellable;
import com.questrail.telerelay.time.MonotonicClock;
import com.questrail.telerelay.time.MonotonicScheduler;
import com.questrail.telerelay.transport.ConnectionListener;
import com.questrail.telerelay.transport.PeerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * AbstractAgent
 * =============================================================================
 * Connection lifecycle shared by the field agents.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   Disconnected ──connect──► Connected (hello sent)
 *        ▲                         │
 *        └──── reconnectDelay ◄────┘ lost / refused
 * </pre>
 *
 * Connection attempts run on the agent's {@link MonotonicScheduler}. After a
 * refused attempt or a lost connection the agent waits
 * {@link AgentConfig#reconnectDelay()} and tries again, until {@link #stop()}.
 *
 * <h2>Subclass contract</h2>
 * {@link #onConnected} and {@link #onDisconnected} are called exactly once per
 * established connection, in that order. The connector is not owned by the
 * agent and outlives {@link #stop()}. Inbound messages arrive through
 * {@link ConnectionListener#onMessage} and must not block.
 */
public abstract class AbstractAgent implements ConnectionListener
{
    private static final Logger log = LoggerFactory.getLogger(AbstractAgent.class);

    protected final AgentConfig config;
    protected final MonotonicScheduler scheduler;
    protected final MonotonicClock monotonicClock;

    private final PeerConnector connector;

    private PeerConnection connection;
    private boolean running;
    private Cancellable pendingConnect;

    protected AbstractAgent(AgentConfig config,
                            PeerConnector connector,
                            MonotonicScheduler scheduler,
                            MonotonicClock monotonicClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
    }

    public synchronized void start()
    {
        if (running) {
            return;
        }
        running = true;
        log.info("Starting {} agent {}", config.role().wireName(), config.agentId());
        pendingConnect = scheduler.scheduleAfter(Duration.ZERO, monotonicClock, this::connect);
    }

    public void stop()
    {
        PeerConnection open;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            if (pendingConnect != null) {
                pendingConnect.cancel();
                pendingConnect = null;
            }
            open = connection;
            connection = null;
        }
        if (open != null) {
            open.close();
            onDisconnected(open);
        }
    }

    public synchronized boolean isConnected()
    {
        return connection != null;
    }

    protected synchronized Optional<PeerConnection> connection()
    {
        return Optional.ofNullable(connection);
    }

    void connect()
    {
        synchronized (this) {
            pendingConnect = null;
            if (!running) {
                return;
            }
        }

        PeerConnection opened;
        try {
            log.info("Connecting to relay at {}", config.relayAddress());
            opened = connector.connect(this);
            opened.send(new Hello(config.agentId(), config.role()));
        } catch (ConnectionLostException e) {
            log.warn("{}. Retrying in {} s", e.getMessage(), config.reconnectDelay().toSeconds());
            scheduleReconnect();
            return;
        }

        synchronized (this) {
            if (!running) {
                opened.close();
                return;
            }
            if (!opened.isAlive()) {
                // Closed before it was published; onClosed has already been ignored.
                scheduleReconnect();
                return;
            }
            connection = opened;
        }
        log.info("Connected to relay at {}", opened.remoteAddress());
        onConnected(opened);
    }

    @Override
    public void onClosed(PeerConnection closed, Throwable cause)
    {
        synchronized (this) {
            if (connection != closed) {
                return;
            }
            connection = null;
        }
        if (cause != null) {
            log.warn("Connection to relay lost: {}. Retrying in {} s", cause.getMessage(), config.reconnectDelay().toSeconds());
        } else {
            log.warn("Relay closed the connection. Retrying in {} s", config.reconnectDelay().toSeconds());
        }
        onDisconnected(closed);
        scheduleReconnect();
    }

    private synchronized void scheduleReconnect()
    {
        if (running) {
            pendingConnect = scheduler.scheduleAfter(config.reconnectDelay(), monotonicClock, this::connect);
        }
    }

    /**
     * The connection is established and the handshake has been sent.
     */
    protected abstract void onConnected(PeerConnection connection);

    /**
     * The connection is gone, either lost or closed by {@link #stop()}.
     */
    protected abstract void onDisconnected(PeerConnection connection);
}
