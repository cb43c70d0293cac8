package com.questrail.telerelay.agent;

import com.questrail.telerelay.agent.hardware.DacVoltageActuator;
import com.questrail.telerelay.agent.hardware.PollingPositionProvider;
import com.questrail.telerelay.agent.hardware.ThresholdVoltageSensor;
import com.questrail.telerelay.agent.hardware.sim.SimulatedAnalogInput;
import com.questrail.telerelay.agent.hardware.sim.SimulatedDacOutput;
import com.questrail.telerelay.agent.hardware.sim.SimulatedPositionSource;
import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.protocol.codec.impl.JsonMessageCodec;
import com.questrail.telerelay.protocol.model.GeoPosition;
import com.questrail.telerelay.time.MonotonicClock;
import com.questrail.telerelay.time.MonotonicScheduler;
import com.questrail.telerelay.time.ScheduledExecutorScheduler;
import com.questrail.telerelay.time.SystemMonotonicClock;
import com.questrail.telerelay.time.SystemWallClock;
import com.questrail.telerelay.transport.PeerConnector;
import com.questrail.telerelay.transport.tcp.netty.NettyPeerConnector;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Field agent entry point. Runs one simulated agent until terminated.
 */
@Command(
        name = "telemetry-agent",
        mixinStandardHelpOptions = true,
        description = "Simulated field agent for the telemetry relay",
        subcommands = {
                AgentCommand.MeasurementCommand.class,
                AgentCommand.ActuationCommand.class
        }
)
public final class AgentCommand implements Runnable {

    @Option(names = "--relay-host", description = "Relay host (default: ${DEFAULT-VALUE})", defaultValue = "127.0.0.1")
    String relayHost;

    @Option(names = "--relay-port", description = "Relay port (default: the role's standard port)")
    Integer relayPort;

    @Option(names = "--id", description = "Agent id announced in the handshake (default: <role>-agent)")
    String agentId;

    @Option(names = "--reconnect-delay-ms", description = "Wait before reconnecting (default: ${DEFAULT-VALUE})",
            defaultValue = "5000")
    long reconnectDelayMs;

    @Option(names = "--gps-period-ms", description = "Position poll period (default: ${DEFAULT-VALUE})",
            defaultValue = "3000")
    long positionPeriodMs;

    @Option(names = "--origin", split = ",", description = "Simulated start position as lat,lon (default: ${DEFAULT-VALUE})",
            defaultValue = "42.3601,-71.0589")
    double[] origin;

    @Option(names = "--seed", description = "Seed for the simulated sources")
    Long seed;

    @Override
    public void run() {
        System.out.println("Use subcommands: measurement | actuation");
    }

    AgentConfig.Builder config(Role role) {
        AgentConfig.Builder b = AgentConfig.builder(role)
                .withReconnectDelay(Duration.ofMillis(reconnectDelayMs))
                .withPositionRefresh(Duration.ofMillis(positionPeriodMs));
        if (agentId != null) {
            b.withAgentId(agentId);
        }
        int port = relayPort != null ? relayPort : AgentConfig.builder(role).build().relayAddress().getPort();
        b.withRelayAddress(new InetSocketAddress(relayHost, port));
        return b;
    }

    Random random() {
        return seed == null ? new Random() : new Random(seed);
    }

    GeoPosition originPosition() {
        if (origin == null || origin.length != 2) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--origin expects lat,lon");
        }
        return new GeoPosition(origin[0], origin[1]);
    }

    /**
     * Runs an agent with its position poller until the JVM is terminated.
     */
    static int runUntilTerminated(AgentConfig config, AgentFactory factory, AgentCommand parent) throws InterruptedException {
        MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, config.role().wireName() + "-agent");
            t.setDaemon(true);
            return t;
        });
        MonotonicScheduler scheduler = new ScheduledExecutorScheduler(executor, clock);
        PeerConnector connector = new NettyPeerConnector(config.role(), config.relayAddress(), new JsonMessageCodec(),
                config.maxFrameLength(), config.connectTimeout(), SystemWallClock.INSTANCE);
        PollingPositionProvider positions = new PollingPositionProvider(
                new SimulatedPositionSource(parent.originPosition(), parent.random()), scheduler, clock, config.positionRefresh());

        AbstractAgent agent = factory.create(config, connector, positions, scheduler, clock);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            agent.stop();
            positions.stop();
            connector.shutdown();
            executor.shutdown();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            stopped.countDown();
        }, config.role().wireName() + "-agent-shutdown"));

        positions.start();
        agent.start();
        stopped.await();
        return 0;
    }

    @FunctionalInterface
    interface AgentFactory {
        AbstractAgent create(AgentConfig config,
                             PeerConnector connector,
                             PollingPositionProvider positions,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock);
    }

    @Command(name = "measurement", mixinStandardHelpOptions = true,
            description = "Sample a simulated voltage probe and stream it to the relay")
    static final class MeasurementCommand implements Callable<Integer> {
        @ParentCommand
        AgentCommand parent;

        @Option(names = "--interval-ms", description = "Telemetry period (default: ${DEFAULT-VALUE})", defaultValue = "500")
        long intervalMs;

        @Option(names = "--dropout", description = "Probability of a disconnected-probe sample (default: ${DEFAULT-VALUE})",
                defaultValue = "0.05")
        double dropout;

        @Override
        public Integer call() throws Exception {
            AgentConfig config = parent.config(Role.MEASUREMENT)
                    .withReportInterval(Duration.ofMillis(intervalMs))
                    .build();
            return runUntilTerminated(config, (c, connector, positions, scheduler, clock) -> new MeasurementAgent(
                    c, connector,
                    new ThresholdVoltageSensor(new SimulatedAnalogInput(clock, parent.random(), dropout)),
                    positions, scheduler, clock, SystemWallClock.INSTANCE), parent);
        }
    }

    @Command(name = "actuation", mixinStandardHelpOptions = true,
            description = "Apply forwarded commands to a simulated DAC and acknowledge them")
    static final class ActuationCommand implements Callable<Integer> {
        @ParentCommand
        AgentCommand parent;

        @Override
        public Integer call() throws Exception {
            AgentConfig config = parent.config(Role.ACTUATION).build();
            return runUntilTerminated(config, (c, connector, positions, scheduler, clock) -> new ActuationAgent(
                    c, connector, new DacVoltageActuator(new SimulatedDacOutput()),
                    positions, scheduler, clock, SystemWallClock.INSTANCE), parent);
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new AgentCommand()).execute(args));
    }
}
