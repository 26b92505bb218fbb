package com.questrail.kiosk.payment.terminal;

import com.questrail.kiosk.payment.model.TransactionResponse;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a pay or reversal call: the raw call code plus the terminal's
 * response, which may be absent when the call itself failed.
 */
public record TerminalReply(TerminalErrorCode code, TransactionResponse response)
{
    public TerminalReply {
        Objects.requireNonNull(code, "code");
    }

    public static TerminalReply of(TransactionResponse response) {
        return new TerminalReply(TerminalErrorCode.OK, Objects.requireNonNull(response, "response"));
    }

    public static TerminalReply failure(TerminalErrorCode code) {
        return new TerminalReply(code, null);
    }

    public Optional<TransactionResponse> responseIfPresent() {
        return Optional.ofNullable(response);
    }
}
