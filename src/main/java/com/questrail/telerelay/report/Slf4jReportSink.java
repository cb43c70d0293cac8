package com.questrail.telerelay.report;

import com.questrail.telerelay.core.session.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Writes a one-line session summary to the log.
 */
public final class Slf4jReportSink implements ReportSink
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jReportSink.class);

    @Override
    public void publish(SessionSummary summary)
    {
        log.info("Session report: {} records, {} forwarded, {} timed out, mean delay {} ms (min {}, max {}), peer {}, stop reason {}",
                summary.records().size(),
                summary.cyclesAttempted(),
                summary.cyclesTimedOut(),
                String.format(Locale.ROOT, "%.2f", summary.meanDelayMs()),
                summary.minDelayMs().isPresent() ? String.format(Locale.ROOT, "%.2f", summary.minDelayMs().getAsDouble()) : "-",
                summary.maxDelayMs().isPresent() ? String.format(Locale.ROOT, "%.2f", summary.maxDelayMs().getAsDouble()) : "-",
                summary.actuationPeer().orElse("N/A"),
                summary.stopReason());
    }
}
