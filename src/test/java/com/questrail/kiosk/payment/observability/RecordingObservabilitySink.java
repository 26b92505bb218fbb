package com.questrail.kiosk.payment.observability;

import com.questrail.kiosk.payment.internal.engine.TransactionState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements PaymentObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(TransactionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSupervisionEvent(SupervisionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(PaymentErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<TransactionStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof TransactionStateTransitionEvent)
            .map(e -> (TransactionStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    /**
     * Target states of every recorded transition, in order.
     */
    public synchronized List<TransactionState> visitedStates() {
        return getStateTransitions().stream()
            .map(TransactionStateTransitionEvent::to)
            .collect(Collectors.toList());
    }

    public synchronized List<SupervisionEvent.Kind> supervisionKinds() {
        return events.stream()
            .filter(e -> e instanceof SupervisionEvent)
            .map(e -> ((SupervisionEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized List<PaymentErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof PaymentErrorEvent)
            .map(e -> (PaymentErrorEvent) e)
            .collect(Collectors.toList());
    }
}
