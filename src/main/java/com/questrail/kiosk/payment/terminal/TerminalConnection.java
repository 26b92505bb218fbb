package com.questrail.kiosk.payment.terminal;

import com.questrail.kiosk.payment.model.TransactionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * TerminalConnection
 * -----------------------------------------------------------------------------
 * One logical session to the terminal, owned by the operation that opened it.
 *
 * <p>Intended for try-with-resources: {@link #close()} disconnects a session
 * that is still connected and always releases the underlying
 * {@link TerminalApi}, whatever the outcome of the operation.</p>
 *
 * <p>Not thread-safe. A connection never outlives the call that opened it.</p>
 */
public final class TerminalConnection implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(TerminalConnection.class);

    private final TerminalApi api;
    private final String address;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private boolean closed;

    private TerminalConnection(TerminalApi api, String address) {
        this.api = Objects.requireNonNull(api, "api");
        this.address = Objects.requireNonNull(address, "address");
    }

    public static TerminalConnection open(TerminalApiFactory terminals, String address) {
        Objects.requireNonNull(terminals, "terminals");
        return new TerminalConnection(terminals.create(), address);
    }

    public String address() {
        return address;
    }

    public ConnectionState state() {
        return state;
    }

    public TerminalErrorCode connect() {
        requireOpen();
        state = ConnectionState.CONNECTING;
        final TerminalErrorCode result;
        try {
            result = api.connect(address);
        } catch (RuntimeException e) {
            state = ConnectionState.FAILED;
            throw e;
        }
        state = result.ok() ? ConnectionState.CONNECTED : ConnectionState.FAILED;
        return result;
    }

    public TerminalReply pay(TransactionRequest request) {
        requireConnected();
        return Objects.requireNonNull(api.pay(request), "terminal returned no pay reply");
    }

    public TerminalReply reverse(int amount) {
        requireConnected();
        return Objects.requireNonNull(api.reverse(amount), "terminal returned no reversal reply");
    }

    public TerminalErrorCode disconnect() {
        requireOpen();
        if (state != ConnectionState.CONNECTED) {
            return TerminalErrorCode.NOT_CONNECTED;
        }
        try {
            return api.disconnect();
        } finally {
            state = ConnectionState.DISCONNECTED;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (state == ConnectionState.CONNECTED) {
                TerminalErrorCode result = api.disconnect();
                if (!result.ok()) {
                    log.warn("Disconnect from {} on close returned {}", address, result);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Disconnect from {} on close failed", address, e);
        } finally {
            state = ConnectionState.DISCONNECTED;
            api.close();
        }
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Terminal connection to " + address + " is closed");
        }
    }

    private void requireConnected() {
        requireOpen();
        if (state != ConnectionState.CONNECTED) {
            throw new IllegalStateException("Terminal connection to " + address + " is " + state);
        }
    }
}
