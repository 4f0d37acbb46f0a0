package com.questrail.mixer.protocol.osc.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled query deadline or keepalive tick.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled earlier.
     */
    boolean cancel();
}
