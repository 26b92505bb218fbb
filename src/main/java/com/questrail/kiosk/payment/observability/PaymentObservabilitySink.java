package com.questrail.kiosk.payment.observability;

/**
 * Main interface for receiving payment peripheral observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface PaymentObservabilitySink {
    /**
     * Called when a transaction moves between states.
     * @param event the transition details
     */
    void onStateTransition(TransactionStateTransitionEvent event);

    /**
     * Called when the driver supervisor acts on the driver process or channel.
     * @param event the supervision event
     */
    void onSupervisionEvent(SupervisionEvent event);

    /**
     * Called when an operation fails unexpectedly.
     * @param event the error event
     */
    void onError(PaymentErrorEvent event);
}
