package com.questrail.mixer.protocol.osc.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler used by the request correlator (reply deadlines) and by the
 * keepalive scheduler (subscription refresh).
 *
 * <p>Deadlines are expressed in monotonic nanoseconds, never in wall-clock
 * instants. Tests substitute a deterministic implementation so that a 500 ms
 * probe timeout can be exercised without sleeping.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline (from {@link MonotonicClock#nowNanos()})
     * @param task          task to run
     * @return cancellation handle
     * @throws java.util.concurrent.RejectedExecutionException if the scheduler
     *         has been shut down
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after a delay measured on the given clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
