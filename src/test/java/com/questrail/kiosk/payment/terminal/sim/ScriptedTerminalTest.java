package com.questrail.kiosk.payment.terminal.sim;

import com.questrail.kiosk.payment.model.EntryMethod;
import com.questrail.kiosk.payment.model.TransactionRequest;
import com.questrail.kiosk.payment.model.TransactionStatus;
import com.questrail.kiosk.payment.model.TransactionType;
import com.questrail.kiosk.payment.terminal.TerminalApi;
import com.questrail.kiosk.payment.terminal.TerminalErrorCode;
import com.questrail.kiosk.payment.terminal.TerminalException;
import com.questrail.kiosk.payment.terminal.TerminalReply;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScriptedTerminalTest {

    private final ScriptedTerminal terminal = new ScriptedTerminal();

    @Test
    void unscriptedTerminalApprovesChipSales() {
        TerminalApi api = terminal.create();

        assertEquals(TerminalErrorCode.OK, api.connect("10.0.0.1"));
        TerminalReply reply = api.pay(new TransactionRequest(1234, 1, false));

        assertEquals(TerminalErrorCode.OK, reply.code());
        assertEquals(TransactionStatus.APPROVED, reply.response().status());
        assertEquals(EntryMethod.CHIP, reply.response().entry());
        assertEquals("000000001234", reply.response().transactionAmount());
    }

    @Test
    void scriptsAreConsumedInOrder() {
        terminal.onPay(TerminalReply.of(ScriptedTerminal.declined(10)))
                .onPay(TerminalReply.failure(TerminalErrorCode.TIMEOUT));
        TerminalApi api = terminal.create();
        api.connect("10.0.0.1");

        assertEquals(TransactionStatus.DECLINED, api.pay(new TransactionRequest(10, 1, false)).response().status());
        assertEquals(TerminalErrorCode.TIMEOUT, api.pay(new TransactionRequest(10, 1, false)).code());
        assertEquals(TransactionStatus.APPROVED, api.pay(new TransactionRequest(10, 1, false)).response().status());
    }

    @Test
    void scriptedFailuresAreThrownFromTheCall() {
        terminal.onReverseThrow(new TerminalException("no line"));
        TerminalApi api = terminal.create();

        assertThrows(TerminalException.class, () -> api.reverse(50));
        assertEquals(1, terminal.count(ScriptedTerminal.Call.REVERSE));
    }

    @Test
    void defaultReversalIsAReversalRecord() {
        TerminalReply reply = terminal.create().reverse(700);

        assertEquals(TransactionType.REVERSAL, reply.response().type());
        assertEquals("000000000700", reply.response().totalAmount());
    }

    @Test
    void callsAreRecordedWithAddressAndAmount() {
        TerminalApi api = terminal.create();
        api.connect("10.0.0.7");
        api.pay(new TransactionRequest(99, 1, false));
        api.disconnect();
        api.close();

        assertEquals(new ScriptedTerminal.RecordedCall(ScriptedTerminal.Call.PAY, "10.0.0.7", 99), terminal.calls().get(1));
        assertEquals(4, terminal.calls().size());
        assertEquals(1, terminal.sessionsCreated());
    }

    @Test
    void swipedApprovalNeedsSignature() {
        assertTrue(ScriptedTerminal.approved(100, EntryMethod.SWIPE).entry().requiresSignature());
    }
}
