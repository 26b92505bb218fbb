package com.questrail.kiosk.payment.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure inside a payment operation.
 */
public record PaymentErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
