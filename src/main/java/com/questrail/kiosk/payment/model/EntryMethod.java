package com.questrail.kiosk.payment.model;

/**
 * How the card was presented to the terminal.
 */
public enum EntryMethod
{
    UNKNOWN("0", "UNKNOWN"),
    CHIP("1", "ICC"),
    SWIPE("2", "SWIPED"),
    CONTACTLESS("3", "CONTACTLESS"),
    MANUAL("4", "KEYED");

    private final String code;
    private final String receiptText;

    EntryMethod(String code, String receiptText) {
        this.code = code;
        this.receiptText = receiptText;
    }

    public String code() {
        return code;
    }

    public String receiptText() {
        return receiptText;
    }

    /**
     * A swiped card is verified by signature, which an unattended kiosk
     * cannot capture.
     */
    public boolean requiresSignature() {
        return this == SWIPE;
    }

    public static EntryMethod fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String trimmed = code.trim();
        for (EntryMethod method : values()) {
            if (method.code.equals(trimmed)) {
                return method;
            }
        }
        return UNKNOWN;
    }
}
