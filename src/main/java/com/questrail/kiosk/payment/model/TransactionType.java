package com.questrail.kiosk.payment.model;

public enum TransactionType
{
    SALE(1, "SALE"),
    REFUND(2, "REFUND"),
    REVERSAL(3, "REVERSAL"),
    UNKNOWN(0, "UNKNOWN");

    private final int code;
    private final String receiptText;

    TransactionType(int code, String receiptText) {
        this.code = code;
        this.receiptText = receiptText;
    }

    public int code() {
        return code;
    }

    public String receiptText() {
        return receiptText;
    }

    public static TransactionType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        try {
            int value = Integer.parseInt(code.trim());
            for (TransactionType type : values()) {
                if (type.code == value) {
                    return type;
                }
            }
        } catch (NumberFormatException e) {
            return UNKNOWN;
        }
        return UNKNOWN;
    }
}
