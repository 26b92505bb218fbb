package com.questrail.kiosk.payment.model;

/**
 * A single sale submitted to the terminal.
 *
 * @param amount      amount in minor currency units, strictly positive
 * @param posNumber   point-of-sale number from the active configuration
 * @param forceOnline whether the terminal must authorize online
 */
public record TransactionRequest(int amount, int posNumber, boolean forceOnline)
{
    public TransactionRequest {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }
}
