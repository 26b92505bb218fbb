package com.questrail.kiosk.payment.observability;

import com.questrail.kiosk.payment.internal.engine.TransactionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jPaymentObservabilitySinkTest {

    @Test
    void acceptsEveryEventKindWithoutThrowing() {
        Slf4jPaymentObservabilitySink sink = new Slf4jPaymentObservabilitySink();
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        assertDoesNotThrow(() -> {
            sink.onStateTransition(new TransactionStateTransitionEvent(now, 1, TransactionState.IDLE, TransactionState.CONNECTING, 100));
            sink.onStateTransition(new TransactionStateTransitionEvent(now, 1, TransactionState.AUTHORIZING, TransactionState.COMMITTED, 100));
            for (SupervisionEvent.Kind kind : SupervisionEvent.Kind.values()) {
                sink.onSupervisionEvent(new SupervisionEvent(now, kind, "detail"));
            }
            sink.onError(new PaymentErrorEvent(now, "boom", new IllegalStateException("boom")));
        });
    }

    @Test
    void terminalTransitionsAreTheAuthorizationEndStates() {
        Instant now = Instant.EPOCH;
        assertTrue(new TransactionStateTransitionEvent(now, 1, TransactionState.AUTHORIZING, TransactionState.COMMITTED, 1).terminal());
        assertTrue(new TransactionStateTransitionEvent(now, 1, TransactionState.AUTHORIZING, TransactionState.DECLINED_OR_ERROR, 1).terminal());
        assertTrue(new TransactionStateTransitionEvent(now, 1, TransactionState.REVERSING, TransactionState.REVERSED, 1).terminal());
        assertFalse(new TransactionStateTransitionEvent(now, 1, TransactionState.CONNECTED, TransactionState.AUTHORIZING, 1).terminal());
        assertFalse(new TransactionStateTransitionEvent(now, 1, TransactionState.PERSISTED, TransactionState.IDLE, 1).terminal());
    }
}
