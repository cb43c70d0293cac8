package com.questrail.telerelay.report;

/**
 * A report sink failed to persist a session report.
 */
public final class ReportSinkException extends Exception
{
    public ReportSinkException(String message) {
        super(message);
    }

    public ReportSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
