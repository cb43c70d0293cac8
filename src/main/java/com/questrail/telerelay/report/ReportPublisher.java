package com.questrail.telerelay.report;

import com.questrail.telerelay.core.session.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fans a finalized session out to every configured {@link ReportSink}.
 *
 * <p>Sessions without records are skipped. A failing sink is logged and
 * does not prevent the remaining sinks from running.</p>
 */
public final class ReportPublisher
{
    private static final Logger log = LoggerFactory.getLogger(ReportPublisher.class);

    private final List<ReportSink> sinks;

    public ReportPublisher(List<ReportSink> sinks)
    {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    /**
     * @return number of sinks that accepted the report
     */
    public int publish(SessionSummary summary)
    {
        Objects.requireNonNull(summary, "summary");
        if (summary.isEmpty()) {
            log.info("No data was logged in this session, skipping report");
            return 0;
        }

        int accepted = 0;
        for (ReportSink sink : sinks) {
            try {
                sink.publish(summary);
                accepted++;
            } catch (ReportSinkException e) {
                log.error("Report sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("Report sink {} failed unexpectedly", sink.getClass().getSimpleName(), e);
            }
        }
        return accepted;
    }
}
