package com.questrail.kiosk.payment.observability;

/**
 * No-op implementation of PaymentObservabilitySink.
 */
public final class NullObservabilitySink implements PaymentObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(TransactionStateTransitionEvent event) {}

    @Override
    public void onSupervisionEvent(SupervisionEvent event) {}

    @Override
    public void onError(PaymentErrorEvent event) {}
}
