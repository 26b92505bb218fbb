package com.questrail.kiosk.payment.observability;

import java.time.Instant;

/**
 * Record representing an action taken on the driver process or its channel.
 */
public record SupervisionEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        STALE_INSTANCE_KILLED,
        DRIVER_LAUNCHED,
        DRIVER_READY,
        DRIVER_EXITED,
        CHANNEL_OPENED,
        CHANNEL_CLOSED
    }
}
