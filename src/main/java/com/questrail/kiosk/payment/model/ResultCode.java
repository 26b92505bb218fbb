package com.questrail.kiosk.payment.model;

import com.questrail.kiosk.payment.terminal.TerminalErrorCode;

/**
 * ResultCode
 * -----------------------------------------------------------------------------
 * Coarse result classification reported by every driver operation.
 *
 * <p>The numeric {@link #code()} is what the host platform sees in its status
 * details. Raw terminal codes are carried alongside (see
 * {@link DriverResult#terminalCode()}) and never replace this value.</p>
 */
public enum ResultCode
{
    SUCCESS(0),

    /** Any unanticipated failure, including exceptions caught at an operation boundary. */
    GENERIC_ERROR(1),

    /** Bad amount or configuration, rejected before any I/O. */
    VALIDATION_ERROR(2),

    /** The terminal could not be reached. */
    CONNECT_ERROR(3),

    /** The terminal rejected the request before processing it. */
    SUBMIT_ERROR(4),

    /** The terminal processed the transaction and declined it. */
    TRANSACTION_FAILED(5),

    /** An authorized transaction was unwound by a business rule. */
    TRANSACTION_CANCELLED(6),

    /** The driver process could not be killed, launched or reached. */
    SUPERVISION_ERROR(7);

    private final int code;

    ResultCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Maps the raw result of a pay submission: {@code OK} passes through as
     * {@link #SUCCESS}, anything else is a {@link #SUBMIT_ERROR}.
     */
    public static ResultCode fromSubmission(TerminalErrorCode submission) {
        return submission.ok() ? SUCCESS : SUBMIT_ERROR;
    }
}
