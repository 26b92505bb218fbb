package com.questrail.kiosk.payment.observability;

import com.questrail.kiosk.payment.internal.engine.TransactionState;

import java.time.Instant;

/**
 * Record representing one state transition of a payment transaction.
 */
public record TransactionStateTransitionEvent(
    Instant timestamp,
    long transactionId,
    TransactionState from,
    TransactionState to,
    int amount
) {
    /**
     * Whether the transition reached an end state of the authorization
     * (committed, declined, reversed) as opposed to an intermediate step.
     */
    public boolean terminal() {
        return to == TransactionState.COMMITTED
            || to == TransactionState.DECLINED_OR_ERROR
            || to == TransactionState.REVERSED;
    }
}
