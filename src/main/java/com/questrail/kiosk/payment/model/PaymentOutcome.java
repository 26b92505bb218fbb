package com.questrail.kiosk.payment.model;

import com.questrail.kiosk.payment.terminal.TerminalErrorCode;

import java.util.Objects;

/**
 * PaymentOutcome
 * -----------------------------------------------------------------------------
 * Immutable result of one {@code Pay} call as decided by the transaction engine.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@link OutcomeKind#SUCCESSFUL} carries {@link ResultCode#SUCCESS} and a
 *       positive paid amount</li>
 *   <li>{@link OutcomeKind#CANCELLED} has a paid amount of zero and a customer
 *       receipt</li>
 *   <li>every other kind has a paid amount of zero</li>
 * </ul>
 * The canonical constructor rejects any combination that breaks these rules.
 *
 * @param kind            business outcome
 * @param resultCode      coarse result code reported to the host
 * @param terminalCode    raw terminal code of the call that decided the outcome
 * @param paidAmount      committed amount in minor currency units
 * @param customerReceipt whether a customer-facing ticket was produced
 * @param uncertain       whether the customer may have been charged despite a non-successful outcome
 * @param message         human-readable description
 */
public record PaymentOutcome(OutcomeKind kind,
                             ResultCode resultCode,
                             int terminalCode,
                             int paidAmount,
                             boolean customerReceipt,
                             boolean uncertain,
                             String message)
{
    public PaymentOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resultCode, "resultCode");
        message = message == null ? "" : message;

        if (paidAmount < 0) {
            throw new IllegalArgumentException("paidAmount must be non-negative");
        }
        if (kind == OutcomeKind.SUCCESSFUL) {
            if (paidAmount == 0) {
                throw new IllegalArgumentException("A successful payment must have a non-zero paid amount");
            }
            if (resultCode != ResultCode.SUCCESS) {
                throw new IllegalArgumentException("A successful payment must carry result code SUCCESS");
            }
        }
        else if (paidAmount != 0) {
            throw new IllegalArgumentException(kind + " payment must have a paid amount of zero");
        }
        if (kind == OutcomeKind.CANCELLED && !customerReceipt) {
            throw new IllegalArgumentException("A cancelled payment always produces a customer receipt");
        }
    }

    public static PaymentOutcome successful(int paidAmount) {
        return new PaymentOutcome(OutcomeKind.SUCCESSFUL, ResultCode.SUCCESS, TerminalErrorCode.OK.code(),
                paidAmount, true, false, "Payment succeeded");
    }

    public static PaymentOutcome failed(String message) {
        return new PaymentOutcome(OutcomeKind.FAILED, ResultCode.TRANSACTION_FAILED, TerminalErrorCode.OK.code(),
                0, true, false, message);
    }

    public static PaymentOutcome cancelled(TerminalErrorCode reversalCode, String message) {
        return new PaymentOutcome(OutcomeKind.CANCELLED, ResultCode.TRANSACTION_CANCELLED, reversalCode.code(),
                0, true, !reversalCode.ok(), message);
    }

    public static PaymentOutcome error(ResultCode resultCode, String message) {
        return new PaymentOutcome(OutcomeKind.ERROR, resultCode, TerminalErrorCode.OK.code(),
                0, false, false, message);
    }

    public static PaymentOutcome error(ResultCode resultCode, TerminalErrorCode terminalCode, String message) {
        return new PaymentOutcome(OutcomeKind.ERROR, resultCode, terminalCode.code(),
                0, false, false, message);
    }

    /**
     * An authorization reached the terminal but its final state could not be
     * confirmed. Nothing is reported as paid; the host is told the payment is
     * uncertain.
     */
    public static PaymentOutcome unconfirmed(ResultCode resultCode, String message) {
        return new PaymentOutcome(OutcomeKind.ERROR, resultCode, TerminalErrorCode.OK.code(),
                0, false, true, message);
    }

    /**
     * The terminal answered with a status that is neither approved nor
     * declined. The result code follows the raw submission result.
     */
    public static PaymentOutcome ambiguous(TerminalErrorCode submission, String message) {
        return new PaymentOutcome(OutcomeKind.ERROR, ResultCode.fromSubmission(submission), submission.code(),
                0, false, true, message);
    }

    public boolean succeeded() {
        return kind == OutcomeKind.SUCCESSFUL && resultCode == ResultCode.SUCCESS;
    }
}
