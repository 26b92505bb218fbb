package com.questrail.kiosk.payment.model;

/**
 * Transaction status codes reported by the terminal in the response's status
 * field, with their receipt wording and their {@link TransactionResult}.
 */
public enum TransactionStatus
{
    APPROVED("0", TransactionResult.SUCCESSFUL, "TRANSACTION APPROVED"),
    APPROVED_OFFLINE("1", TransactionResult.SUCCESSFUL, "TRANSACTION APPROVED OFFLINE"),
    DECLINED("2", TransactionResult.FAILED, "TRANSACTION DECLINED"),
    DECLINED_BY_CARD("3", TransactionResult.FAILED, "DECLINED BY CARD"),
    CARD_ERROR("4", TransactionResult.FAILED, "CARD ERROR"),
    CANCELLED_BY_CUSTOMER("5", TransactionResult.FAILED, "TRANSACTION CANCELLED"),
    TIMED_OUT("6", TransactionResult.OTHER, "TRANSACTION TIMED OUT"),
    HOST_UNAVAILABLE("7", TransactionResult.OTHER, "HOST COMMUNICATION FAILURE"),
    UNKNOWN("", TransactionResult.OTHER, "TRANSACTION STATUS UNKNOWN");

    private final String code;
    private final TransactionResult result;
    private final String receiptText;

    TransactionStatus(String code, TransactionResult result, String receiptText) {
        this.code = code;
        this.result = result;
        this.receiptText = receiptText;
    }

    public String code() {
        return code;
    }

    public TransactionResult result() {
        return result;
    }

    public String receiptText() {
        return receiptText;
    }

    /**
     * Resolves a raw status code. Unrecognized or missing codes map to
     * {@link #UNKNOWN}, which classifies as {@link TransactionResult#OTHER}.
     */
    public static TransactionStatus fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String trimmed = code.trim();
        for (TransactionStatus status : values()) {
            if (status != UNKNOWN && status.code.equals(trimmed)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
