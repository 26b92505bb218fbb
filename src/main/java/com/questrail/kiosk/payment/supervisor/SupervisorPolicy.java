package com.questrail.kiosk.payment.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of the driver readiness wait.
 *
 * <ul>
 *   <li><b>readinessTimeout</b>: how long a freshly launched driver has to
 *       become reachable before start fails.</li>
 *   <li><b>pollInterval</b>: spacing between reachability probes.</li>
 * </ul>
 */
public record SupervisorPolicy(Duration readinessTimeout, Duration pollInterval)
{
    public SupervisorPolicy {
        Objects.requireNonNull(readinessTimeout, "readinessTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (readinessTimeout.isNegative() || readinessTimeout.isZero()) {
            throw new IllegalArgumentException("readinessTimeout must be positive");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    /**
     * Defaults: 15s readiness timeout, 250ms poll interval.
     */
    public static SupervisorPolicy defaults() {
        return new SupervisorPolicy(Duration.ofSeconds(15), Duration.ofMillis(250));
    }
}
