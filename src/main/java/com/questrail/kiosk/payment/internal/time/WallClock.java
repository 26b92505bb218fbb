package com.questrail.kiosk.payment.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for timestamps: observability events, journal file names
 * and heartbeat start times.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for deadlines such as driver readiness polling.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
