package com.questrail.telerelay.runtime;

import com.questrail.telerelay.api.RelayStatus;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.api.TelemetryRelay;
import com.questrail.telerelay.config.RelayConfig;
import com.questrail.telerelay.core.correlate.AcknowledgementCorrelator;
import com.questrail.telerelay.core.correlate.ResponseCorrelator;
import com.questrail.telerelay.core.peer.PeerConnection;
import com.questrail.telerelay.core.peer.PeerRegistry;
import com.questrail.telerelay.core.relay.PositionBoard;
import com.questrail.telerelay.core.relay.RelayLoop;
import com.questrail.telerelay.core.session.SessionLog;
import com.questrail.telerelay.core.session.SessionStopReason;
import com.questrail.telerelay.core.session.SessionSummary;
import com.questrail.telerelay.observability.NullObservabilitySink;
import com.questrail.telerelay.observability.PeerStateEvent;
import com.questrail.telerelay.observability.RelayCycleEvent;
import com.questrail.telerelay.observability.RelayErrorEvent;
import com.questrail.telerelay.observability.RelayObservabilitySink;
import com.questrail.telerelay.observability.SessionStateEvent;
import com.questrail.telerelay.protocol.codec.MessageCodec;
import com.questrail.telerelay.protocol.codec.impl.JsonMessageCodec;
import com.questrail.telerelay.report.CsvReportSink;
import com.questrail.telerelay.report.ReportPublisher;
import com.questrail.telerelay.report.ReportSink;
import com.questrail.telerelay.report.Slf4jReportSink;
import com.questrail.telerelay.time.SystemWallClock;
import com.questrail.telerelay.time.WallClock;
import com.questrail.telerelay.transport.PeerAcceptor;
import com.questrail.telerelay.transport.tcp.netty.NettyPeerAcceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * RelayRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the relay process.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>one I/O loop and one dispatch group per listener role
 *       (see {@link NettyPeerAcceptor})</li>
 *   <li>one session-control thread that applies start, stop and automatic
 *       stops, so operator commands and peer loss never race each other</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds both listeners. {@link #stop()} finalizes the active
 * session (reason {@link SessionStopReason#SHUTDOWN}), publishes its report,
 * closes every connection and releases all threads.
 */
public final class RelayRuntime implements TelemetryRelay
{
    private static final Logger log = LoggerFactory.getLogger(RelayRuntime.class);

    private final RelayConfig config;
    private final PeerRegistry registry;
    private final SessionLog sessionLog;
    private final PositionBoard positions;
    private final RelayLoop relayLoop;
    private final PeerAcceptor measurementAcceptor;
    private final PeerAcceptor actuationAcceptor;
    private final ReportPublisher reportPublisher;
    private final ExecutorService controlExecutor;

    private RelayRuntime(RelayConfig config,
                         PeerRegistry registry,
                         SessionLog sessionLog,
                         PositionBoard positions,
                         RelayLoop relayLoop,
                         PeerAcceptor measurementAcceptor,
                         PeerAcceptor actuationAcceptor,
                         ReportPublisher reportPublisher,
                         ExecutorService controlExecutor)
    {
        this.config = config;
        this.registry = registry;
        this.sessionLog = sessionLog;
        this.positions = positions;
        this.relayLoop = relayLoop;
        this.measurementAcceptor = measurementAcceptor;
        this.actuationAcceptor = actuationAcceptor;
        this.reportPublisher = reportPublisher;
        this.controlExecutor = controlExecutor;
    }

    public void start()
    {
        measurementAcceptor.start();
        try {
            actuationAcceptor.start();
        } catch (RuntimeException e) {
            measurementAcceptor.stop();
            throw e;
        }
    }

    public void stop()
    {
        long graceMillis = config.timingPolicy().shutdownGrace().toMillis();
        try {
            finish(SessionStopReason.SHUTDOWN).get(graceMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("Failed to finalize session during shutdown", e.getCause());
        } catch (TimeoutException e) {
            log.warn("Session was not finalized within {} ms, shutting down anyway", graceMillis);
        } catch (RejectedExecutionException e) {
            log.debug("Relay already stopped");
        }

        measurementAcceptor.stop();
        actuationAcceptor.stop();
        registry.closeAll();

        controlExecutor.shutdown();
        try {
            if (!controlExecutor.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                controlExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            controlExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public CompletableFuture<Void> startSession()
    {
        return CompletableFuture.runAsync(relayLoop::startSession, controlExecutor);
    }

    @Override
    public CompletableFuture<Optional<SessionSummary>> stopSession()
    {
        return finish(SessionStopReason.OPERATOR_REQUEST);
    }

    @Override
    public RelayStatus status()
    {
        return new RelayStatus(
                peerName(Role.MEASUREMENT),
                peerName(Role.ACTUATION),
                sessionLog.state(),
                sessionLog.size(),
                positions.latest(Role.MEASUREMENT),
                positions.latest(Role.ACTUATION));
    }

    public Optional<SocketAddress> measurementAddress()
    {
        return measurementAcceptor.localAddress();
    }

    public Optional<SocketAddress> actuationAddress()
    {
        return actuationAcceptor.localAddress();
    }

    private CompletableFuture<Optional<SessionSummary>> finish(SessionStopReason reason)
    {
        return CompletableFuture.supplyAsync(() -> {
            Optional<SessionSummary> summary = relayLoop.stopSession(reason);
            summary.ifPresent(reportPublisher::publish);
            return summary;
        }, controlExecutor);
    }

    private void requestAutoStop(SessionStopReason reason)
    {
        try {
            finish(reason).whenComplete((summary, error) -> {
                if (error != null) {
                    log.error("Automatic session stop ({}) failed", reason, error);
                } else if (summary.isPresent()) {
                    log.info("Session stopped automatically: {}", reason);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Ignoring {} after shutdown", reason);
        }
    }

    private Optional<String> peerName(Role role)
    {
        return registry.current(role).map(RelayRuntime::describe);
    }

    private static String describe(PeerConnection connection)
    {
        return connection.agentId()
                .map(id -> id + "@" + connection.remoteAddress())
                .orElseGet(() -> String.valueOf(connection.remoteAddress()));
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private RelayConfig config = RelayConfig.builder().build();
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Consumer<RelayStatus> statusCallback;
        private final List<ReportSink> reportSinks = new ArrayList<>();
        private boolean logReports = true;
        private WallClock clock = SystemWallClock.INSTANCE;
        private MessageCodec codec = new JsonMessageCodec();

        public Builder withConfig(RelayConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Called with a fresh {@link RelayStatus} after every peer or session change.
         */
        public Builder withStatusCallback(Consumer<RelayStatus> callback)
        {
            this.statusCallback = callback;
            return this;
        }

        /**
         * Additional report destination, on top of the configured CSV directory.
         */
        public Builder withReportSink(ReportSink sink)
        {
            this.reportSinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public Builder withReportLogging(boolean enabled)
        {
            this.logReports = enabled;
            return this;
        }

        public Builder withWallClock(WallClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withMessageCodec(MessageCodec codec)
        {
            this.codec = codec;
            return this;
        }

        public RelayRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(codec, "codec");
            RelayObservabilitySink baseSink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Core state
            PeerRegistry registry = new PeerRegistry();
            ResponseCorrelator correlator = new AcknowledgementCorrelator();
            SessionLog sessionLog = new SessionLog(clock);
            PositionBoard positions = new PositionBoard();

            // 2. Status fan-out: the runtime is only known after construction
            RelayRuntime[] self = new RelayRuntime[1];
            RelayObservabilitySink effectiveSink = baseSink;
            if (statusCallback != null) {
                Consumer<RelayStatus> callback = statusCallback;
                Runnable publishStatus = () -> {
                    RelayRuntime runtime = self[0];
                    if (runtime != null) {
                        callback.accept(runtime.status());
                    }
                };
                effectiveSink = new RelayObservabilitySink() {
                    @Override
                    public void onPeerEvent(PeerStateEvent event) {
                        baseSink.onPeerEvent(event);
                        publishStatus.run();
                    }

                    @Override
                    public void onSessionEvent(SessionStateEvent event) {
                        baseSink.onSessionEvent(event);
                        publishStatus.run();
                    }

                    @Override public void onCycleEvent(RelayCycleEvent event) { baseSink.onCycleEvent(event); }
                    @Override public void onError(RelayErrorEvent event) { baseSink.onError(event); }
                };
            }

            RelayLoop relayLoop = new RelayLoop(registry, correlator, sessionLog, positions,
                    clock, config.timingPolicy(), effectiveSink);

            // 3. Reports
            List<ReportSink> sinks = new ArrayList<>();
            if (logReports) {
                sinks.add(new Slf4jReportSink());
            }
            config.reportDirectory().ifPresent(dir -> sinks.add(new CsvReportSink(dir, config.reportZone(), clock)));
            sinks.addAll(reportSinks);
            ReportPublisher publisher = new ReportPublisher(sinks);

            // 4. Transport
            ExecutorService controlExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "relay-session-control");
                t.setDaemon(true);
                return t;
            });

            PeerAcceptor measurementAcceptor = new NettyPeerAcceptor(Role.MEASUREMENT, config.measurementBind(),
                    codec, config.maxFrameLength(), config.dispatchThreads(), clock);
            PeerAcceptor actuationAcceptor = new NettyPeerAcceptor(Role.ACTUATION, config.actuationBind(),
                    codec, config.maxFrameLength(), config.dispatchThreads(), clock);

            RelayRuntime runtime = new RelayRuntime(config, registry, sessionLog, positions, relayLoop,
                    measurementAcceptor, actuationAcceptor, publisher, controlExecutor);
            self[0] = runtime;

            // 5. Connection semantics
            for (PeerAcceptor acceptor : List.of(measurementAcceptor, actuationAcceptor)) {
                acceptor.setListener(new RelayConnectionHandler(acceptor.role(), registry, relayLoop, correlator,
                        positions, runtime::requestAutoStop, effectiveSink, clock));
            }
            return runtime;
        }
    }
}
