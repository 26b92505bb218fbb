package com.questrail.kiosk.payment.model;

/**
 * Business outcome of a payment attempt.
 *
 * <p>Only the transaction-status field of the terminal response decides between
 * {@link #SUCCESSFUL}, {@link #FAILED} and {@link #CANCELLED}; raw call failures
 * always surface as {@link #ERROR}.</p>
 */
public enum OutcomeKind
{
    SUCCESSFUL,
    FAILED,
    /** Authorized, then reversed. */
    CANCELLED,
    ERROR
}
