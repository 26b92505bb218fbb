package com.questrail.kiosk.payment.transport;

/**
 * Raised when the channel to the driver process cannot be opened or cannot
 * carry a call: unreachable endpoint, timeout, closed connection, or a request
 * rejected by the server.
 */
public final class DriverChannelException extends RuntimeException
{
    public DriverChannelException(String message) {
        super(message);
    }

    public DriverChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
