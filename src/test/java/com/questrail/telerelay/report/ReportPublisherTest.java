package com.questrail.telerelay.report;

import com.questrail.telerelay.core.session.SessionSummary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.questrail.telerelay.report.ReportFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

final class ReportPublisherTest {

    private static final class CollectingSink implements ReportSink {
        final List<SessionSummary> published = new ArrayList<>();

        @Override
        public void publish(SessionSummary summary) {
            published.add(summary);
        }
    }

    @Test
    void emptySessionIsNotPublished() {
        CollectingSink sink = new CollectingSink();
        ReportPublisher publisher = new ReportPublisher(List.of(sink));

        assertEquals(0, publisher.publish(summary(List.of())));
        assertTrue(sink.published.isEmpty());
    }

    @Test
    void failingSinkDoesNotStopTheOthers() {
        CollectingSink before = new CollectingSink();
        CollectingSink after = new CollectingSink();
        ReportSink failing = s -> {
            throw new ReportSinkException("disk full");
        };
        ReportPublisher publisher = new ReportPublisher(List.of(before, failing, new Slf4jReportSink(), after));

        assertEquals(3, publisher.publish(summary(List.of(proper(1, 100.0, 50.0)))));
        assertEquals(1, before.published.size());
        assertEquals(1, after.published.size());
    }
}
