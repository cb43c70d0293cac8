package com.questrail.telerelay.agent;

import com.questrail.telerelay.api.Role;
import com.questrail.telerelay.config.AgentConfig;
import com.questrail.telerelay.protocol.model.GeoPosition;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class AgentCommandTest {

    private final AgentCommand command = new AgentCommand();
    private final CommandLine commandLine = new CommandLine(command);

    @Test
    void measurementDefaultsTargetTheMeasurementPort() {
        CommandLine.ParseResult result = commandLine.parseArgs("measurement");

        AgentCommand.MeasurementCommand measurement =
                (AgentCommand.MeasurementCommand) result.subcommand().commandSpec().userObject();
        AgentConfig config = command.config(Role.MEASUREMENT).build();

        assertEquals(500, measurement.intervalMs);
        assertEquals("127.0.0.1", config.relayAddress().getHostString());
        assertEquals(65430, config.relayAddress().getPort());
        assertEquals("measurement-agent", config.agentId());
        assertEquals(Duration.ofSeconds(5), config.reconnectDelay());
    }

    @Test
    void parentOptionsApplyToTheActuationAgent() {
        commandLine.parseArgs("--relay-host", "10.0.0.9", "--relay-port", "9001", "--id", "actuator_pi",
                "--reconnect-delay-ms", "250", "--gps-period-ms", "1000", "actuation");

        AgentConfig config = command.config(Role.ACTUATION).build();

        assertEquals("10.0.0.9", config.relayAddress().getHostString());
        assertEquals(9001, config.relayAddress().getPort());
        assertEquals("actuator_pi", config.agentId());
        assertEquals(Duration.ofMillis(250), config.reconnectDelay());
        assertEquals(Duration.ofSeconds(1), config.positionRefresh());
    }

    @Test
    void originIsParsedAsLatitudeLongitude() {
        commandLine.parseArgs("--origin", "51.5,-0.12", "actuation");

        assertEquals(new GeoPosition(51.5, -0.12), command.originPosition());
    }

    @Test
    void seededRandomIsReproducible() {
        commandLine.parseArgs("--seed", "7", "measurement");

        assertEquals(command.random().nextLong(), command.random().nextLong());
    }
}
