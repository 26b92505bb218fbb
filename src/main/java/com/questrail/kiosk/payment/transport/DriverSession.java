package com.questrail.kiosk.payment.transport;

/**
 * A single call session created from a {@link DriverChannel}.
 *
 * <p>Sessions are short-lived: open one per remote invocation and close it
 * before returning. Calls on a session throw {@link DriverChannelException}
 * when the channel cannot carry them.</p>
 */
public interface DriverSession extends DriverService, AutoCloseable
{
    @Override
    void close();
}
