package com.questrail.mixer.protocol.osc.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for query deadlines and keepalive cadence.
 *
 * <h2>Binding invariant</h2>
 * Reply deadlines and the subscription refresh period MUST be measured with a
 * monotonic source. Wall-clock time ({@link WallClock}) is only stamped onto
 * observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
