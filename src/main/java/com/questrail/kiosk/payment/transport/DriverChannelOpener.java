package com.questrail.kiosk.payment.transport;

/**
 * Opens a {@link DriverChannel} to an endpoint with the given timeouts.
 */
@FunctionalInterface
public interface DriverChannelOpener
{
    DriverChannel open(DriverEndpoint endpoint, ChannelTimeoutPolicy timeouts);
}
