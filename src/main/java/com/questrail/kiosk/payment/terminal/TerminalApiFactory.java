package com.questrail.kiosk.payment.terminal;

/**
 * Creates a fresh {@link TerminalApi} session for each top-level operation.
 *
 * <p>Vendor bindings register an implementation through
 * {@code META-INF/services/com.questrail.kiosk.payment.terminal.TerminalApiFactory}.</p>
 */
@FunctionalInterface
public interface TerminalApiFactory
{
    TerminalApi create();
}
