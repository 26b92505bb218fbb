package com.questrail.kiosk.payment.terminal.sim;

import com.questrail.kiosk.payment.model.CardholderVerification;
import com.questrail.kiosk.payment.model.EntryMethod;
import com.questrail.kiosk.payment.model.TransactionRequest;
import com.questrail.kiosk.payment.model.TransactionResponse;
import com.questrail.kiosk.payment.model.TransactionStatus;
import com.questrail.kiosk.payment.terminal.TerminalApi;
import com.questrail.kiosk.payment.terminal.TerminalApiFactory;
import com.questrail.kiosk.payment.terminal.TerminalErrorCode;
import com.questrail.kiosk.payment.terminal.TerminalReply;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * ScriptedTerminal
 * -----------------------------------------------------------------------------
 * In-memory stand-in for the vendor terminal binding.
 *
 * <p>Each call consumes the next scripted answer for its kind; when the script
 * runs dry the terminal behaves like a healthy device approving a chip-and-PIN
 * sale for the requested amount. Every call is recorded in order.</p>
 *
 * <p>Used by the test suite and by the driver's simulator mode for bench runs
 * without hardware. It must never be configured on a live kiosk.</p>
 */
public final class ScriptedTerminal implements TerminalApiFactory
{
    public enum Call {
        CONNECT,
        PAY,
        REVERSE,
        DISCONNECT,
        CLOSE
    }

    /**
     * One recorded call. {@code amount} is zero for calls that carry none.
     */
    public record RecordedCall(Call call, String address, int amount) {}

    private final Deque<TerminalErrorCode> connectScript = new ArrayDeque<>();
    private final Deque<IntFunction<TerminalReply>> payScript = new ArrayDeque<>();
    private final Deque<IntFunction<TerminalReply>> reverseScript = new ArrayDeque<>();
    private final Deque<TerminalErrorCode> disconnectScript = new ArrayDeque<>();
    private final List<RecordedCall> calls = new ArrayList<>();

    private int sessionsCreated;

    public synchronized ScriptedTerminal onConnect(TerminalErrorCode result) {
        connectScript.addLast(Objects.requireNonNull(result, "result"));
        return this;
    }

    public synchronized ScriptedTerminal onPay(TerminalReply reply) {
        Objects.requireNonNull(reply, "reply");
        payScript.addLast(amount -> reply);
        return this;
    }

    /**
     * Answers the next pay by calling {@code answer} with the requested
     * amount, on the paying thread.
     */
    public synchronized ScriptedTerminal onPayAnswer(IntFunction<TerminalReply> answer) {
        payScript.addLast(Objects.requireNonNull(answer, "answer"));
        return this;
    }

    public synchronized ScriptedTerminal onPayThrow(RuntimeException failure) {
        Objects.requireNonNull(failure, "failure");
        payScript.addLast(amount -> {
            throw failure;
        });
        return this;
    }

    public synchronized ScriptedTerminal onReverse(TerminalReply reply) {
        Objects.requireNonNull(reply, "reply");
        reverseScript.addLast(amount -> reply);
        return this;
    }

    public synchronized ScriptedTerminal onReverseThrow(RuntimeException failure) {
        Objects.requireNonNull(failure, "failure");
        reverseScript.addLast(amount -> {
            throw failure;
        });
        return this;
    }

    public synchronized ScriptedTerminal onDisconnect(TerminalErrorCode result) {
        disconnectScript.addLast(Objects.requireNonNull(result, "result"));
        return this;
    }

    @Override
    public synchronized TerminalApi create() {
        sessionsCreated++;
        return new Session();
    }

    public synchronized List<RecordedCall> calls() {
        return List.copyOf(calls);
    }

    public synchronized long count(Call call) {
        return calls.stream().filter(c -> c.call() == call).count();
    }

    public synchronized int sessionsCreated() {
        return sessionsCreated;
    }

    // ---------------------------------------------------------------------
    // Canned responses
    // ---------------------------------------------------------------------

    public static TransactionResponse approved(int amount, EntryMethod entry) {
        return sampleResponse(amount)
                .status(TransactionStatus.APPROVED)
                .entry(entry)
                .verification(entry == EntryMethod.SWIPE ? CardholderVerification.SIGNATURE : CardholderVerification.PIN)
                .hostMessage("AUTH CODE 012345")
                .build();
    }

    public static TransactionResponse declined(int amount) {
        return sampleResponse(amount)
                .status(TransactionStatus.DECLINED)
                .entry(EntryMethod.CHIP)
                .verification(CardholderVerification.PIN)
                .hostMessage("DECLINED")
                .build();
    }

    public static TransactionResponse reversed(int amount) {
        return sampleResponse(amount)
                .status(TransactionStatus.APPROVED)
                .entry(EntryMethod.SWIPE)
                .transactionType("3")
                .hostMessage("REVERSAL ACCEPTED")
                .build();
    }

    private static TransactionResponse.Builder sampleResponse(int amount) {
        String minor = String.format("%012d", amount);
        return TransactionResponse.builder()
                .merchantName("KIOSK MERCHANT")
                .merchantAddress1("1 HIGH STREET")
                .merchantAddress2("LONDON")
                .acquirerMerchantId("000000012345678")
                .terminalId("87654321")
                .aid("A0000000031010")
                .cardSchemeName("VISA")
                .pan("************0119")
                .panSequenceNumber("01")
                .transactionType("1")
                .currency("826")
                .transactionAmount(minor)
                .totalAmount(minor)
                .diagnosticCode(TerminalErrorCode.OK.code())
                .acquirerResponseCode("00")
                .receiptNumber("0001")
                .transactionDateTime("");
    }

    // ---------------------------------------------------------------------
    // Session
    // ---------------------------------------------------------------------

    private final class Session implements TerminalApi
    {
        private String address = "";

        @Override
        public TerminalErrorCode connect(String address) {
            synchronized (ScriptedTerminal.this) {
                this.address = address;
                calls.add(new RecordedCall(Call.CONNECT, address, 0));
                TerminalErrorCode next = connectScript.pollFirst();
                return next != null ? next : TerminalErrorCode.OK;
            }
        }

        @Override
        public TerminalReply pay(TransactionRequest request) {
            IntFunction<TerminalReply> next;
            synchronized (ScriptedTerminal.this) {
                calls.add(new RecordedCall(Call.PAY, address, request.amount()));
                next = payScript.pollFirst();
            }
            return next != null
                    ? next.apply(request.amount())
                    : TerminalReply.of(approved(request.amount(), EntryMethod.CHIP));
        }

        @Override
        public TerminalReply reverse(int amount) {
            IntFunction<TerminalReply> next;
            synchronized (ScriptedTerminal.this) {
                calls.add(new RecordedCall(Call.REVERSE, address, amount));
                next = reverseScript.pollFirst();
            }
            return next != null ? next.apply(amount) : TerminalReply.of(reversed(amount));
        }

        @Override
        public TerminalErrorCode disconnect() {
            synchronized (ScriptedTerminal.this) {
                calls.add(new RecordedCall(Call.DISCONNECT, address, 0));
                TerminalErrorCode next = disconnectScript.pollFirst();
                return next != null ? next : TerminalErrorCode.OK;
            }
        }

        @Override
        public void close() {
            synchronized (ScriptedTerminal.this) {
                calls.add(new RecordedCall(Call.CLOSE, address, 0));
            }
        }
    }
}
