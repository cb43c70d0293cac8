package com.questrail.telerelay.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled tasks.
 *
 * <p>Kept deliberately tiny so it can be implemented by a deterministic test
 * scheduler as well as by a {@code ScheduledExecutorService}-backed one.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
