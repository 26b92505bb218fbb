package com.questrail.kiosk.payment.terminal;

/**
 * Raw result codes returned by the terminal binding for connect, pay, reverse
 * and disconnect calls, and used as the diagnostic code inside a response.
 */
public enum TerminalErrorCode
{
    OK(0),
    NOT_CONNECTED(1),
    CONNECT_FAILED(2),
    ALREADY_CONNECTED(3),
    SEND_FAILED(4),
    RECEIVE_FAILED(5),
    TIMEOUT(6),
    INVALID_PARAMETER(7),
    TERMINAL_BUSY(8),
    UNKNOWN(99);

    private final int code;

    TerminalErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean ok() {
        return this == OK;
    }

    public static TerminalErrorCode fromCode(int code) {
        for (TerminalErrorCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
