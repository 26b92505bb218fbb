package com.questrail.kiosk.api;

import java.util.Objects;

/**
 * Answer to {@link PaymentPeripheral#pay(PayRequest)}.
 *
 * @param success                  whether the sale was committed
 * @param details                  paid amount and receipt flag
 * @param status                   result code and description
 * @param uncertainPaymentDetected whether the customer may have been charged
 *                                 even though {@code success} is {@code false}
 */
public record PayResult(boolean success, PayDetails details, StatusDetails status, boolean uncertainPaymentDetected)
{
    public PayResult {
        Objects.requireNonNull(details, "details");
        Objects.requireNonNull(status, "status");
    }
}
