package com.questrail.kiosk.payment.internal.engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * TransactionState
 * =============================================================================
 * States of one payment attempt inside the engine.
 *
 * <pre>
 * IDLE -> CONNECTING -> CONNECTED -> AUTHORIZING
 *      -> { COMMITTED | DECLINED_OR_ERROR | REVERSAL_REQUIRED -> REVERSING -> REVERSED }
 *      -> PERSISTED -> IDLE
 * </pre>
 *
 * <p>Any state other than {@code IDLE} may fall back to {@code IDLE} when the
 * attempt ends early (connect or submit failure, unexpected exception).</p>
 */
public enum TransactionState
{
    IDLE,
    CONNECTING,
    CONNECTED,
    AUTHORIZING,
    COMMITTED,
    DECLINED_OR_ERROR,
    REVERSAL_REQUIRED,
    REVERSING,
    REVERSED,
    PERSISTED;

    public Set<TransactionState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(CONNECTED, IDLE);
            case CONNECTED -> EnumSet.of(AUTHORIZING, IDLE);
            case AUTHORIZING -> EnumSet.of(COMMITTED, DECLINED_OR_ERROR, REVERSAL_REQUIRED, IDLE);
            case REVERSAL_REQUIRED -> EnumSet.of(REVERSING, IDLE);
            case REVERSING -> EnumSet.of(REVERSED, IDLE);
            case COMMITTED, DECLINED_OR_ERROR, REVERSED -> EnumSet.of(PERSISTED, IDLE);
            case PERSISTED -> EnumSet.of(IDLE);
        };
    }

    public boolean canTransitionTo(TransactionState next) {
        return successors().contains(next);
    }
}
