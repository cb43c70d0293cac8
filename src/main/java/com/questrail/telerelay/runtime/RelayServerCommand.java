package com.questrail.telerelay.runtime;

import com.questrail.telerelay.config.RelayConfig;
import com.questrail.telerelay.core.relay.RelayTimingPolicy;
import com.questrail.telerelay.observability.Slf4jRelayObservabilitySink;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Relay process entry point.
 */
@Command(
        name = "telemetry-relay",
        description = "Relay measurement telemetry to the actuation agent and log corrected command latency",
        mixinStandardHelpOptions = true,
        version = "telemetry-relay 0.1.0"
)
public class RelayServerCommand implements Callable<Integer> {

    @Option(names = "--bind", description = "Listening interface (default: ${DEFAULT-VALUE})",
            defaultValue = "0.0.0.0")
    String bindHost;

    @Option(names = "--measurement-port", description = "Measurement agent port (default: ${DEFAULT-VALUE})",
            defaultValue = "65430")
    int measurementPort;

    @Option(names = "--actuation-port", description = "Actuation agent port (default: ${DEFAULT-VALUE})",
            defaultValue = "65431")
    int actuationPort;

    @Option(names = "--response-timeout-ms", description = "Acknowledgement wait per command (default: ${DEFAULT-VALUE})",
            defaultValue = "2000")
    long responseTimeoutMs;

    @Option(names = "--max-frame-bytes", description = "Largest accepted message body (default: ${DEFAULT-VALUE})",
            defaultValue = "65536")
    int maxFrameBytes;

    @Option(names = "--report-dir", description = "Directory for daily CSV reports (default: none)")
    Path reportDirectory;

    @Option(names = "--zone", description = "Time zone of report timestamps (default: system zone)")
    ZoneId zone;

    @Option(names = "--no-console", description = "Run without the interactive console until terminated")
    boolean noConsole;

    RelayConfig relayConfig() {
        RelayConfig.Builder config = RelayConfig.builder()
                .withMeasurementBind(new InetSocketAddress(bindHost, measurementPort))
                .withActuationBind(new InetSocketAddress(bindHost, actuationPort))
                .withTimingPolicy(RelayTimingPolicy.withResponseTimeout(Duration.ofMillis(responseTimeoutMs)))
                .withMaxFrameLength(maxFrameBytes)
                .withReportDirectory(reportDirectory);
        if (zone != null) {
            config.withReportZone(zone);
        }
        return config.build();
    }

    @Override
    public Integer call() throws Exception {
        RelayRuntime runtime = RelayRuntime.builder()
                .withConfig(relayConfig())
                .withObservabilitySink(new Slf4jRelayObservabilitySink())
                .build();
        runtime.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            runtime.stop();
            stopped.countDown();
        }, "relay-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        if (noConsole) {
            stopped.await();
            return 0;
        }

        new RelayConsole(runtime, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out).run();
        Runtime.getRuntime().removeShutdownHook(hook);
        runtime.stop();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new RelayServerCommand()).execute(args));
    }
}
