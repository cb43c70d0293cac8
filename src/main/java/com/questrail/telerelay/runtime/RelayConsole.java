package com.questrail.telerelay.runtime;

import com.questrail.telerelay.api.RelayStatus;
import com.questrail.telerelay.api.TelemetryRelay;
import com.questrail.telerelay.core.session.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * RelayConsole
 * -----------------------------------------------------------------------------
 * Line-oriented operator console.
 *
 * <pre>
 *   start    begin (or restart) a logging session
 *   stop     end the session and write its report
 *   status   show peers, positions and session state
 *   quit     leave the console
 * </pre>
 *
 * Commands are case-insensitive. End of input behaves like {@code quit}.
 */
public final class RelayConsole
{
    private static final Logger log = LoggerFactory.getLogger(RelayConsole.class);

    private final TelemetryRelay relay;
    private final BufferedReader in;
    private final PrintStream out;

    public RelayConsole(TelemetryRelay relay, BufferedReader in, PrintStream out)
    {
        this.relay = Objects.requireNonNull(relay, "relay");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Read and execute commands until {@code quit} or end of input.
     */
    public void run() throws IOException
    {
        printHelp();
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line.trim().toLowerCase(Locale.ROOT))) {
                return;
            }
        }
    }

    /**
     * @return {@code false} once the console should exit
     */
    boolean execute(String command)
    {
        try {
            switch (command) {
                case "" -> { }
                case "start" -> {
                    relay.startSession().get();
                    RelayStatus status = relay.status();
                    out.println("Session started.");
                    if (!status.readyToRelay()) {
                        out.println("Waiting for both agents to connect before any data is logged.");
                    }
                }
                case "stop" -> {
                    Optional<SessionSummary> summary = relay.stopSession().get();
                    if (summary.isEmpty()) {
                        out.println("No session is active.");
                    } else if (summary.get().isEmpty()) {
                        out.println("Session stopped. No data was logged.");
                    } else {
                        out.printf(Locale.ROOT, "Session stopped. %d records, average delay %.2f ms.%n",
                                summary.get().records().size(), summary.get().meanDelayMs());
                    }
                }
                case "status" -> printStatus(relay.status());
                case "quit", "exit" -> {
                    return false;
                }
                case "help" -> printHelp();
                default -> out.println("Unknown command: " + command + " (try 'help')");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("Command '{}' failed", command, e.getCause());
            out.println("Command failed: " + e.getCause().getMessage());
        }
        return true;
    }

    private void printStatus(RelayStatus status)
    {
        out.println("Measurement: " + status.measurementPeer().orElse("not connected")
                + status.measurementPosition().map(p -> " at " + p).orElse(""));
        out.println("Actuation:   " + status.actuationPeer().orElse("not connected")
                + status.actuationPosition().map(p -> " at " + p).orElse(""));
        out.println("Session:     " + status.sessionState() + " (" + status.recordCount() + " records)");
    }

    private void printHelp()
    {
        out.println("Commands: start | stop | status | quit");
    }
}
