package com.questrail.kiosk.payment.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for deadlines.
 *
 * <h2>Binding invariant</h2>
 * Every wait with a deadline (driver readiness, supervision polling) MUST use a
 * monotonic time source. Wall-clock time is permitted only for timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
