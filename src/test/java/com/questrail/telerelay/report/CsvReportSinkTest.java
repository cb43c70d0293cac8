package com.questrail.telerelay.report;

import com.questrail.telerelay.time.ManualWallClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.questrail.telerelay.report.ReportFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

final class CsvReportSinkTest {

    @TempDir
    Path dir;

    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2026-03-01T10:05:00Z"));

    @Test
    void sessionsOfOneDayShareAFileWithOneBanner() throws Exception {
        CsvReportSink sink = new CsvReportSink(dir.resolve("reports"), ZoneOffset.UTC, clock);

        sink.publish(summary(List.of(proper(1, 100.0, 50.0))));
        clock.advanceMillis(60_000);
        sink.publish(summary(List.of(proper(1, 200.0, 40.0), junk(2, 200.5, 45.0))));

        Path file = dir.resolve("reports").resolve("2026-03-01.csv");
        assertEquals(file, sink.fileFor(clock.now()));
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);

        assertEquals(CsvReportSink.FILE_BANNER, lines.get(0));
        assertEquals(1, lines.stream().filter(CsvReportSink.FILE_BANNER::equals).count());
        assertEquals(2, lines.stream().filter(l -> l.startsWith("--- New Test Run ---")).count());
        assertTrue(lines.contains("1,00:01:40:000000,00:01:40:050000,50.00,1.5000,Proper,1.5000V,\"(42.5, -71.25)\""));
        assertTrue(lines.contains("2,00:03:20:500000,00:03:20:545000,45.00,Junk Value,Junk,N/A,N/A"));
    }

    @Test
    void nextDayStartsANewFile() throws Exception {
        CsvReportSink sink = new CsvReportSink(dir, ZoneOffset.UTC, clock);

        sink.publish(summary(List.of(proper(1, 100.0, 50.0))));
        clock.set(Instant.parse("2026-03-02T00:00:01Z"));
        sink.publish(summary(List.of(proper(1, 100.0, 50.0))));

        assertTrue(Files.exists(dir.resolve("2026-03-01.csv")));
        assertTrue(Files.exists(dir.resolve("2026-03-02.csv")));
    }

    @Test
    void unwritableDirectoryRaisesReportSinkException() throws Exception {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
        CsvReportSink sink = new CsvReportSink(blocker, ZoneOffset.UTC, clock);

        assertThrows(ReportSinkException.class, () -> sink.publish(summary(List.of(proper(1, 100.0, 50.0)))));
    }

    @Test
    void fieldsWithSeparatorsAreQuoted() {
        assertEquals("plain", CsvReportSink.escape("plain"));
        assertEquals("\"a,b\"", CsvReportSink.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvReportSink.escape("say \"hi\""));
    }
}
