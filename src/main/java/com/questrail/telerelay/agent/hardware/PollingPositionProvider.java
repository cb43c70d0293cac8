package com.questrail.telerelay.agent.hardware;

import com.questrail.telerelay.protocol.model.GeoPosition;
import com.questrail.telerelay.time.Cancellable;
import com.questrail.telerelay.time.MonotonicClock;
import com.questrail.telerelay.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * PollingPositionProvider
 * -----------------------------------------------------------------------------
 * Refreshes the position from a {@link PositionSource} on its own cadence,
 * independent of the telemetry or acknowledgement rate.
 *
 * <p>A poll without a lock, or a failed poll, clears the fix; consumers then
 * report no position until the next successful poll.</p>
 */
public final class PollingPositionProvider implements PositionProvider
{
    private static final Logger log = LoggerFactory.getLogger(PollingPositionProvider.class);

    private final PositionSource source;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration period;

    private volatile Optional<GeoPosition> latest = Optional.empty();
    private volatile boolean running;
    private volatile Cancellable pending;

    public PollingPositionProvider(PositionSource source,
                                   MonotonicScheduler scheduler,
                                   MonotonicClock clock,
                                   Duration period)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.period = Objects.requireNonNull(period, "period");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
    }

    public void start()
    {
        running = true;
        pending = scheduler.scheduleAfter(Duration.ZERO, clock, this::poll);
    }

    public void stop()
    {
        running = false;
        Cancellable c = pending;
        if (c != null) {
            c.cancel();
        }
    }

    @Override
    public Optional<GeoPosition> latestFix()
    {
        return latest;
    }

    void poll()
    {
        if (!running) {
            return;
        }
        try {
            latest = source.acquire();
        } catch (IOException e) {
            log.warn("Position poll failed: {}", e.getMessage());
            latest = Optional.empty();
        } catch (RuntimeException e) {
            log.error("Position source failed unexpectedly", e);
            latest = Optional.empty();
        }
        if (running) {
            pending = scheduler.scheduleAfter(period, clock, this::poll);
        }
    }
}
