package com.questrail.kiosk.payment.transport;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.PaymentOutcome;

/**
 * DriverService
 * =============================================================================
 * The request/response contract served by the terminal-driver process.
 *
 * <p>The transaction engine implements it inside the driver; the host reaches
 * it through a {@link DriverSession}. Implementations report every failure
 * through the returned result and never throw for terminal or business
 * conditions.</p>
 */
public interface DriverService
{
    /**
     * Validates {@code configuration}, performs a connect handshake with the
     * terminal and, on success, makes the configuration active.
     */
    DriverResult init(RuntimeConfiguration configuration);

    /**
     * Liveness check. Performs no terminal I/O.
     */
    DriverResult test();

    /**
     * Runs one sale for {@code amount} minor currency units.
     */
    PaymentOutcome pay(int amount);

    /**
     * Asks the hosting process to stop serving calls.
     */
    DriverResult shutdown();
}
