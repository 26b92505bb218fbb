package com.questrail.kiosk.payment.transport.netty;

/**
 * Remote operations carried by a {@link DriverRequest}.
 */
public enum DriverOperation
{
    INIT,
    TEST,
    PAY,
    SHUTDOWN
}
