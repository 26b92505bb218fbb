package com.questrail.kiosk.payment.model;

/**
 * Three-way classification of a terminal transaction status.
 */
public enum TransactionResult
{
    SUCCESSFUL,
    FAILED,
    /** Neither approved nor declined: timed out, host unreachable, unknown code. */
    OTHER
}
