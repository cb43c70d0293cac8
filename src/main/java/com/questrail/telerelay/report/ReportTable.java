package com.questrail.telerelay.report;

import com.questrail.telerelay.core.session.LatencyRecord;
import com.questrail.telerelay.core.session.SessionSummary;
import com.questrail.telerelay.time.WallClock;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ReportTable
 * -----------------------------------------------------------------------------
 * Lays out one session as a block of rows:
 *
 * <pre>
 *   (blank)
 *   --- New Test Run --- | Timestamp: HH:mm:ss
 *   (blank)
 *   summary rows
 *   (blank)
 *   header
 *   one row per latency record
 * </pre>
 *
 * <p>Times are rendered {@code HH:mm:ss:SSSSSS} in the configured zone. A
 * junk sample shows {@code Junk Value} instead of its voltage; a missing
 * applied voltage shows {@code N/A}.</p>
 */
public final class ReportTable
{
    public static final List<String> HEADER = List.of(
            "Packet #",
            "Measurement Send Time",
            "Corrected Actuation Receive Time",
            "Delay (ms)",
            "Sensor Voltage",
            "Data Status",
            "Applied Voltage (V)",
            "Measurement Position"
    );

    static final String JUNK_VALUE = "Junk Value";
    static final String NOT_AVAILABLE = "N/A";

    private final DateTimeFormatter preciseTime;
    private final DateTimeFormatter shortTime;

    public ReportTable(ZoneId zone)
    {
        Objects.requireNonNull(zone, "zone");
        this.preciseTime = DateTimeFormatter.ofPattern("HH:mm:ss:SSSSSS").withZone(zone);
        this.shortTime = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(zone);
    }

    public List<List<String>> rows(SessionSummary summary, Instant generatedAt)
    {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(generatedAt, "generatedAt");

        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of());
        rows.add(List.of("--- New Test Run ---", "Timestamp: " + shortTime.format(generatedAt)));
        rows.add(List.of());

        rows.add(List.of("Session Start Time", preciseTime.format(summary.startedAt())));
        rows.add(List.of("Connected To (Actuation)", summary.actuationPeer().orElse(NOT_AVAILABLE)));
        rows.add(List.of("Average Communication Delay", String.format(Locale.ROOT, "%.2f ms", summary.meanDelayMs())));
        rows.add(List.of("Commands Forwarded", Long.toString(summary.cyclesAttempted())));
        rows.add(List.of("Timed Out", Long.toString(summary.cyclesTimedOut())));
        rows.add(List.of("Stop Reason", summary.stopReason().name()));
        rows.add(List.of());

        rows.add(HEADER);
        for (LatencyRecord r : summary.records()) {
            rows.add(detailRow(r));
        }
        return rows;
    }

    public List<String> detailRow(LatencyRecord r)
    {
        return List.of(
                Integer.toString(r.sequence()),
                formatEpochSeconds(r.sendTime()),
                formatEpochSeconds(r.correctedReceiptTime()),
                String.format(Locale.ROOT, "%.2f", r.delayMillis()),
                r.status().isProper() ? String.format(Locale.ROOT, "%.4f", r.measuredVoltage()) : JUNK_VALUE,
                r.status().label(),
                r.appliedVoltage().isPresent()
                        ? String.format(Locale.ROOT, "%.4fV", r.appliedVoltage().getAsDouble())
                        : NOT_AVAILABLE,
                r.measurementPosition().map(Object::toString).orElse(NOT_AVAILABLE)
        );
    }

    String formatEpochSeconds(double epochSeconds)
    {
        return preciseTime.format(WallClock.fromEpochSeconds(epochSeconds));
    }
}
