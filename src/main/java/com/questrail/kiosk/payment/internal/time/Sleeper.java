package com.questrail.kiosk.payment.internal.time;

import java.time.Duration;

/**
 * Blocks the calling thread for a polling interval.
 *
 * <p>Split out of the supervisor so tests can advance a manual clock instead
 * of sleeping.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    void sleep(Duration duration) throws InterruptedException;
}
