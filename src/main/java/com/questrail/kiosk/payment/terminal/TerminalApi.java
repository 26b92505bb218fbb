package com.questrail.kiosk.payment.terminal;

import com.questrail.kiosk.payment.model.TransactionRequest;

/**
 * TerminalApi
 * =============================================================================
 * Port onto the vendor SDK that speaks the terminal's native protocol.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Every call is synchronous and may block for as long as the terminal
 *       needs (a pay call waits for the customer)</li>
 *   <li>Call failures are reported as {@link TerminalErrorCode}s; implementations
 *       throw {@link TerminalException} only for defects of the binding itself</li>
 *   <li>One instance serves one logical session and is released with
 *       {@link #close()}</li>
 * </ul>
 *
 * <p>Wire bytes are the binding's business. Nothing above this interface sees
 * them.</p>
 */
public interface TerminalApi extends AutoCloseable
{
    TerminalErrorCode connect(String address);

    TerminalReply pay(TransactionRequest request);

    /**
     * Unwinds the transaction just authorized for {@code amount}.
     */
    TerminalReply reverse(int amount);

    TerminalErrorCode disconnect();

    /**
     * Releases binding resources. Never throws.
     */
    @Override
    void close();
}
