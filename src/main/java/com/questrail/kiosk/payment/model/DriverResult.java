package com.questrail.kiosk.payment.model;

import com.questrail.kiosk.payment.terminal.TerminalErrorCode;

import java.util.Objects;

/**
 * Result of a non-payment driver operation ({@code Init}, {@code Test},
 * {@code Shutdown}).
 *
 * @param code         coarse classification
 * @param terminalCode raw terminal code when the terminal was involved, otherwise {@code 0}
 * @param message      human-readable description, may be empty
 */
public record DriverResult(ResultCode code, int terminalCode, String message)
{
    public DriverResult {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }

    public static DriverResult success() {
        return new DriverResult(ResultCode.SUCCESS, TerminalErrorCode.OK.code(), "");
    }

    public static DriverResult of(ResultCode code, String message) {
        return new DriverResult(code, TerminalErrorCode.OK.code(), message);
    }

    public static DriverResult terminal(ResultCode code, TerminalErrorCode terminalCode, String message) {
        return new DriverResult(code, terminalCode.code(), message);
    }

    public boolean succeeded() {
        return code == ResultCode.SUCCESS;
    }
}
