package com.questrail.telerelay.report;

import com.questrail.telerelay.core.session.SessionSummary;
import com.questrail.telerelay.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * CsvReportSink
 * -----------------------------------------------------------------------------
 * Appends each session report to a per-day CSV file ({@code yyyy-MM-dd.csv})
 * in a report directory. All sessions of one day accumulate in the same file,
 * each introduced by its own separator block.
 */
public final class CsvReportSink implements ReportSink
{
    private static final Logger log = LoggerFactory.getLogger(CsvReportSink.class);

    static final String FILE_BANNER = "--- This file contains all test runs from this date ---";

    private final Path directory;
    private final ReportTable table;
    private final WallClock clock;
    private final DateTimeFormatter dayFormat;

    public CsvReportSink(Path directory, ZoneId zone, WallClock clock)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.table = new ReportTable(Objects.requireNonNull(zone, "zone"));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dayFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(zone);
    }

    /**
     * File the report generated at {@code at} is appended to.
     */
    public Path fileFor(Instant at)
    {
        return directory.resolve(dayFormat.format(at) + ".csv");
    }

    @Override
    public void publish(SessionSummary summary) throws ReportSinkException
    {
        Instant now = clock.now();
        Path file = fileFor(now);
        try {
            Files.createDirectories(directory);
            boolean fresh = Files.notExists(file);
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (fresh) {
                    out.write(csvLine(List.of(FILE_BANNER)));
                }
                for (List<String> row : table.rows(summary, now)) {
                    out.write(csvLine(row));
                }
            }
        } catch (IOException e) {
            throw new ReportSinkException("Failed to append report to " + file, e);
        }
        log.info("Report appended to {}", file);
    }

    static String csvLine(List<String> row)
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(row.get(i)));
        }
        return sb.append('\n').toString();
    }

    static String escape(String field)
    {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
