package com.questrail.kiosk.payment.supervisor;

/**
 * The driver process could not be killed, launched, or brought to a
 * reachable state.
 */
public final class ProcessSupervisionException extends RuntimeException
{
    public ProcessSupervisionException(String message) {
        super(message);
    }

    public ProcessSupervisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
