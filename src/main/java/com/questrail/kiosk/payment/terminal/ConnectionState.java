package com.questrail.kiosk.payment.terminal;

public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    FAILED
}
