package com.questrail.kiosk.payment.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PaymentObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPaymentObservabilitySink implements PaymentObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPaymentObservabilitySink.class);

    @Override
    public void onStateTransition(TransactionStateTransitionEvent event) {
        if (event.terminal()) {
            log.info("Transaction {} ({} minor units): {} -> {}",
                event.transactionId(), event.amount(), event.from(), event.to());
        } else {
            log.debug("Transaction {}: {} -> {}",
                event.transactionId(), event.from(), event.to());
        }
    }

    @Override
    public void onSupervisionEvent(SupervisionEvent event) {
        if (event.kind() == SupervisionEvent.Kind.DRIVER_EXITED
                || event.kind() == SupervisionEvent.Kind.STALE_INSTANCE_KILLED) {
            log.warn("Driver supervision: {} {}", event.kind(), event.detail());
        } else {
            log.info("Driver supervision: {} {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(PaymentErrorEvent event) {
        log.error("Payment error: {}", event.message(), event.cause());
    }
}
