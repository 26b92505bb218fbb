package com.questrail.kiosk.api;

/**
 * PaymentPeripheral
 * =============================================================================
 * Contract between the kiosk platform and a card payment peripheral.
 *
 * <p>The platform loads the peripheral, pushes its settings, initialises it,
 * polls it with {@link #test()} and calls {@link #pay(PayRequest)} once per
 * sale. None of the operations throw: failures are reported through return
 * values and {@link #lastStatus()}.</p>
 */
public interface PaymentPeripheral
{
    String driverId();

    String peripheralName();

    /**
     * Prepares the peripheral for payments.
     *
     * @return {@code true} if the peripheral is ready
     */
    boolean init();

    /**
     * Liveness check.
     */
    boolean test();

    /**
     * Runs one sale.
     */
    PayResult pay(PayRequest request);

    /**
     * Stops the peripheral and releases everything it holds.
     */
    boolean unload();

    /**
     * Applies settings from a serialized factory-details document. Settings
     * the peripheral does not declare are ignored.
     *
     * @return {@code false} if the document cannot be read
     */
    boolean updateSettings(String json);

    /**
     * Identity and declared settings as a JSON document of the form
     * {@code {"Payment":[{...}]}}.
     */
    String getPaymentFactoryDetails();

    PeripheralStatus lastStatus();
}
