package com.questrail.kiosk.payment.model;

import com.questrail.kiosk.payment.terminal.TerminalErrorCode;

/**
 * TransactionResponse
 * -----------------------------------------------------------------------------
 * The terminal's answer to a pay or reversal request, exactly as the vendor
 * binding delivered it.
 *
 * <p>Raw codes are kept as the terminal sent them so that the persisted record
 * is a faithful copy. Typed views ({@link #status()}, {@link #entry()},
 * {@link #verification()}, {@link #type()}) are derived on demand.</p>
 *
 * <p>Instances are never mutated after receipt.</p>
 */
public record TransactionResponse(
        String transactionStatus,
        String entryMethod,
        String merchantName,
        String merchantAddress1,
        String merchantAddress2,
        String acquirerMerchantId,
        String terminalId,
        String aid,
        String cardSchemeName,
        String pan,
        String panSequenceNumber,
        String transactionType,
        String currency,
        String transactionAmount,
        String totalAmount,
        String cvm,
        String hostMessage,
        int diagnosticCode,
        String acquirerResponseCode,
        String receiptNumber,
        String transactionDateTime
) {
    public TransactionStatus status() {
        return TransactionStatus.fromCode(transactionStatus);
    }

    public TransactionResult result() {
        return status().result();
    }

    public EntryMethod entry() {
        return EntryMethod.fromCode(entryMethod);
    }

    public CardholderVerification verification() {
        return CardholderVerification.fromCode(cvm);
    }

    public TransactionType type() {
        return TransactionType.fromCode(transactionType);
    }

    /**
     * The diagnostic (confirmation) code reads {@link TerminalErrorCode#OK}.
     */
    public boolean diagnosticOk() {
        return TerminalErrorCode.fromCode(diagnosticCode).ok();
    }

    public Builder toBuilder() {
        return new Builder()
                .transactionStatus(transactionStatus)
                .entryMethod(entryMethod)
                .merchantName(merchantName)
                .merchantAddress1(merchantAddress1)
                .merchantAddress2(merchantAddress2)
                .acquirerMerchantId(acquirerMerchantId)
                .terminalId(terminalId)
                .aid(aid)
                .cardSchemeName(cardSchemeName)
                .pan(pan)
                .panSequenceNumber(panSequenceNumber)
                .transactionType(transactionType)
                .currency(currency)
                .transactionAmount(transactionAmount)
                .totalAmount(totalAmount)
                .cvm(cvm)
                .hostMessage(hostMessage)
                .diagnosticCode(diagnosticCode)
                .acquirerResponseCode(acquirerResponseCode)
                .receiptNumber(receiptNumber)
                .transactionDateTime(transactionDateTime);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String transactionStatus = "";
        private String entryMethod = "";
        private String merchantName = "";
        private String merchantAddress1 = "";
        private String merchantAddress2 = "";
        private String acquirerMerchantId = "";
        private String terminalId = "";
        private String aid = "";
        private String cardSchemeName = "";
        private String pan = "";
        private String panSequenceNumber = "";
        private String transactionType = "";
        private String currency = "";
        private String transactionAmount = "";
        private String totalAmount = "";
        private String cvm = "";
        private String hostMessage = "";
        private int diagnosticCode;
        private String acquirerResponseCode = "";
        private String receiptNumber = "";
        private String transactionDateTime = "";

        public Builder transactionStatus(String value) { this.transactionStatus = value; return this; }
        public Builder entryMethod(String value) { this.entryMethod = value; return this; }
        public Builder merchantName(String value) { this.merchantName = value; return this; }
        public Builder merchantAddress1(String value) { this.merchantAddress1 = value; return this; }
        public Builder merchantAddress2(String value) { this.merchantAddress2 = value; return this; }
        public Builder acquirerMerchantId(String value) { this.acquirerMerchantId = value; return this; }
        public Builder terminalId(String value) { this.terminalId = value; return this; }
        public Builder aid(String value) { this.aid = value; return this; }
        public Builder cardSchemeName(String value) { this.cardSchemeName = value; return this; }
        public Builder pan(String value) { this.pan = value; return this; }
        public Builder panSequenceNumber(String value) { this.panSequenceNumber = value; return this; }
        public Builder transactionType(String value) { this.transactionType = value; return this; }
        public Builder currency(String value) { this.currency = value; return this; }
        public Builder transactionAmount(String value) { this.transactionAmount = value; return this; }
        public Builder totalAmount(String value) { this.totalAmount = value; return this; }
        public Builder cvm(String value) { this.cvm = value; return this; }
        public Builder hostMessage(String value) { this.hostMessage = value; return this; }
        public Builder diagnosticCode(int value) { this.diagnosticCode = value; return this; }
        public Builder acquirerResponseCode(String value) { this.acquirerResponseCode = value; return this; }
        public Builder receiptNumber(String value) { this.receiptNumber = value; return this; }
        public Builder transactionDateTime(String value) { this.transactionDateTime = value; return this; }

        public Builder status(TransactionStatus status) { return transactionStatus(status.code()); }
        public Builder entry(EntryMethod entry) { return entryMethod(entry.code()); }
        public Builder verification(CardholderVerification verification) { return cvm(verification.code()); }

        public TransactionResponse build() {
            return new TransactionResponse(
                    transactionStatus, entryMethod, merchantName, merchantAddress1, merchantAddress2,
                    acquirerMerchantId, terminalId, aid, cardSchemeName, pan, panSequenceNumber,
                    transactionType, currency, transactionAmount, totalAmount, cvm, hostMessage,
                    diagnosticCode, acquirerResponseCode, receiptNumber, transactionDateTime);
        }
    }
}
