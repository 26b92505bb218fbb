package com.questrail.kiosk.payment.internal.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} implementation backed by {@link System#nanoTime()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Never goes backward</li>
 *   <li>Not affected by wall-clock adjustments (NTP, DST, manual changes)</li>
 * </ul>
 *
 * <p>For deterministic testing, use {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
