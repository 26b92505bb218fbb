package com.questrail.kiosk.payment.terminal;

/**
 * Raised when the terminal binding misbehaves in a way that cannot be expressed
 * as a {@link TerminalErrorCode}, for example an OK call without a response.
 */
public final class TerminalException extends RuntimeException
{
    public TerminalException(String message) {
        super(message);
    }

    public TerminalException(String message, Throwable cause) {
        super(message, cause);
    }
}
