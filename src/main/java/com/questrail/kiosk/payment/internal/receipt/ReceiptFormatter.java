package com.questrail.kiosk.payment.internal.receipt;

import com.questrail.kiosk.payment.model.TransactionResponse;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;

/**
 * ReceiptFormatter
 * =============================================================================
 * Renders the text artifacts produced by a payment attempt.
 *
 * <ul>
 *   <li>{@link #customerTicket} the card holder copy handed to the kiosk printer</li>
 *   <li>{@link #journalRecord} the customer and merchant sections kept in the
 *       transaction journal</li>
 *   <li>{@link #FAILURE_NOTICE} the ticket printed when no payment was taken</li>
 * </ul>
 *
 * <p>Formatting is pure: no I/O, no clock. The caller supplies the print time.</p>
 */
public final class ReceiptFormatter
{
    public static final String FAILURE_NOTICE = "-----\n\n"
            + "Payment failure with\n"
            + "your card or issuer\n"
            + "NO payment has been taken.\n\n"
            + "Please try again with another card,\n"
            + "or at a manned till.\n\n"
            + "-----";

    private static final String RULE = "***********************";

    private static final DateTimeFormatter PRINT_TIME = DateTimeFormatter.ofPattern("HH:mm dd/MM/yyyy");

    // ISO 4217 numeric code -> symbol
    private static final Map<Integer, String> CURRENCY_SYMBOLS = Map.of(
            826, "£",
            978, "€",
            840, "$"
    );

    private ReceiptFormatter() {}

    /**
     * Card holder copy for a committed sale.
     */
    public static String customerTicket(TransactionResponse response, LocalDateTime printedAt) {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(printedAt, "printedAt");

        StringBuilder sb = new StringBuilder();
        sb.append("\n\tCUSTOMER RECEIPT\n");
        sb.append("\t*********************\n\n");
        sb.append('\t').append(text(response.merchantName())).append('\n');
        sb.append('\t').append(text(response.merchantAddress1())).append('\n');
        sb.append('\t').append(text(response.merchantAddress2())).append('\n');
        sb.append('\t').append(text(response.acquirerMerchantId())).append('\t');
        sb.append('\t').append(text(response.terminalId())).append('\n');
        sb.append('\t').append(text(response.cardSchemeName())).append('\n');
        sb.append('\t').append(text(response.aid())).append('\n');
        sb.append('\t').append(text(response.pan())).append('\n');
        sb.append("\tICC PAN.SEQ ").append(text(response.panSequenceNumber())).append('\n');
        sb.append('\t').append(response.entry().receiptText()).append('\n');
        sb.append('\t').append(response.type().receiptText()).append('\n');
        sb.append("\tCARD HOLDER COPY\n");
        sb.append("\tPURCHASE AMOUNT: ")
                .append(currencySymbol(response.currency()))
                .append(formatAmount(response.transactionAmount()))
                .append('\n');
        sb.append('\t').append(PRINT_TIME.format(printedAt)).append('\n');
        sb.append('\t').append(response.verification().receiptText()).append('\n');
        sb.append("\n\tTHANK YOU\n");
        sb.append('\t').append(text(response.hostMessage())).append('\n');
        sb.append("\n\t").append(RULE).append('\n');
        sb.append('\t').append(response.status().receiptText()).append('\n');
        sb.append('\t').append(RULE).append('\n');
        return sb.toString();
    }

    /**
     * Flattened customer and merchant copy of a terminal response, as kept in
     * the transaction journal.
     */
    public static String journalRecord(TransactionResponse response) {
        Objects.requireNonNull(response, "response");
        String symbol = currencySymbol(response.currency());
        String amount = symbol + formatAmount(response.transactionAmount());

        StringBuilder sb = new StringBuilder();
        sb.append("\nCUSTOMER RECEIPT\n");
        sb.append("**********************\n\n");
        sb.append("MERCHANT NAME:  ").append(text(response.merchantName())).append('\n');
        sb.append("MERCHANT ADDR1: ").append(text(response.merchantAddress1())).append('\n');
        sb.append("MERCHANT ADDR2: ").append(text(response.merchantAddress2())).append('\n');
        sb.append("ACQUIRER MERCHANT ID: ").append(text(response.acquirerMerchantId())).append('\n');
        sb.append("ENTRY METHOD: ").append(response.entry().receiptText()).append('\n');
        sb.append("TID: ").append(text(response.terminalId())).append('\n');
        sb.append("AID: ").append(text(response.aid())).append('\n');
        sb.append("CARD SCHEME NAME: ").append(text(response.cardSchemeName())).append('\n');
        sb.append("PAN: ").append(text(response.pan())).append('\n');
        sb.append("PAN SEQUENCE NUMBER: PAN.SEQ ").append(text(response.panSequenceNumber())).append('\n');
        sb.append("TRANSACTION TYPE: ").append(response.type().receiptText()).append('\n');
        sb.append("CURRENCY: ").append(symbol).append('\n');
        sb.append("AMOUNT: ").append(amount).append('\n');
        sb.append("TOTAL AMOUNT: ").append(formatAmount(response.totalAmount())).append('\n');
        sb.append("CVM: ").append(response.verification().receiptText()).append('\n');
        sb.append("HOST MESSAGE: ").append(text(response.hostMessage())).append("\n\n");
        sb.append(RULE).append('\n');
        sb.append(response.status().receiptText()).append('\n');
        sb.append(RULE).append('\n');

        sb.append("\n\nMERCHANT RECEIPT\n");
        sb.append("**********************\n\n");
        sb.append("ACQUIRER MERCHANT ID: ").append(text(response.acquirerMerchantId())).append('\n');
        sb.append("MERCHANT NAME:  ").append(text(response.merchantName())).append('\n');
        sb.append("MERCHANT ADDR1: ").append(text(response.merchantAddress1())).append('\n');
        sb.append("MERCHANT ADDR2: ").append(text(response.merchantAddress2())).append('\n');
        sb.append("ENTRY METHOD: ").append(response.entry().receiptText()).append('\n');
        sb.append("TID: ").append(text(response.terminalId())).append('\n');
        sb.append("AID: ").append(text(response.aid())).append('\n');
        sb.append("CARD SCHEME NAME: ").append(text(response.cardSchemeName())).append('\n');
        sb.append("PAN: ").append(text(response.pan())).append('\n');
        sb.append("PAN SEQUENCE NUMBER: PAN.SEQ ").append(text(response.panSequenceNumber())).append('\n');
        sb.append("TRANSACTION TYPE: ").append(response.type().receiptText()).append('\n');
        sb.append("CURRENCY: ").append(symbol).append('\n');
        sb.append("AMOUNT: ").append(amount).append('\n');
        sb.append("TOTAL AMOUNT: ").append(formatAmount(response.totalAmount())).append('\n');
        sb.append("TRANSACTION DATE TIME: ").append(text(response.transactionDateTime())).append('\n');
        sb.append("CVM: ").append(response.verification().receiptText()).append('\n');
        sb.append("HOST MESSAGE: ").append(text(response.hostMessage())).append('\n');
        sb.append("ACQUIRER RESPONSE CODE: ").append(text(response.acquirerResponseCode())).append('\n');
        sb.append("RECEIPT NUMBER: ").append(text(response.receiptNumber())).append("\n\n");
        sb.append(RULE).append('\n');
        sb.append(response.status().receiptText()).append('\n');
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    /**
     * Symbol for an ISO 4217 numeric currency code; the code itself when the
     * currency is not one the kiosk prints a symbol for, empty when missing.
     */
    public static String currencySymbol(String numericCode) {
        if (numericCode == null || numericCode.isBlank()) {
            return "";
        }
        try {
            String symbol = CURRENCY_SYMBOLS.get(Integer.parseInt(numericCode.trim()));
            return symbol != null ? symbol : numericCode.trim();
        } catch (NumberFormatException e) {
            return numericCode.trim();
        }
    }

    /**
     * Formats an amount given in minor units ({@code "000000002500"}) as a
     * two-decimal major amount ({@code "25.00"}). Unparseable input is returned
     * unchanged.
     */
    public static String formatAmount(String minorUnits) {
        if (minorUnits == null || minorUnits.isBlank()) {
            return "";
        }
        try {
            return BigDecimal.valueOf(Long.parseLong(minorUnits.trim()), 2).toPlainString();
        } catch (NumberFormatException e) {
            return minorUnits.trim();
        }
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
