package com.questrail.kiosk.payment.model;

/**
 * Cardholder verification method (CVM) used for a transaction.
 */
public enum CardholderVerification
{
    NONE("0", "NO CARDHOLDER VERIFICATION"),
    PIN("1", "PIN VERIFIED"),
    SIGNATURE("2", "SIGNATURE REQUIRED"),
    ON_DEVICE("3", "VERIFIED ON DEVICE"),
    UNKNOWN("", "");

    private final String code;
    private final String receiptText;

    CardholderVerification(String code, String receiptText) {
        this.code = code;
        this.receiptText = receiptText;
    }

    public String code() {
        return code;
    }

    public String receiptText() {
        return receiptText;
    }

    public static CardholderVerification fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String trimmed = code.trim();
        for (CardholderVerification cvm : values()) {
            if (cvm != UNKNOWN && cvm.code.equals(trimmed)) {
                return cvm;
            }
        }
        return UNKNOWN;
    }
}
