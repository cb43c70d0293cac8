package com.questrail.telerelay.report;

import com.questrail.telerelay.core.session.SessionSummary;

/**
 * Persists or displays a finalized session.
 *
 * <p>Sink failures never affect relay or session state; the
 * {@link ReportPublisher} logs them and moves on.</p>
 */
public interface ReportSink
{
    /**
     * @param summary finalized session with at least one record
     * @throws ReportSinkException if the report could not be written
     */
    void publish(SessionSummary summary) throws ReportSinkException;
}
