package com.questrail.kiosk.api;

/**
 * What was actually paid.
 *
 * @param paidAmount       committed amount in minor currency units
 * @param hasClientReceipt whether a customer ticket is waiting to be printed
 */
public record PayDetails(int paidAmount, boolean hasClientReceipt)
{
    public static PayDetails none() {
        return new PayDetails(0, false);
    }
}
