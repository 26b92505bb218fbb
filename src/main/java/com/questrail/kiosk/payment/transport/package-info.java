/**
 * Driver Channel Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between the host-side peripheral and the
 * terminal-driver process. Everything above this package sees only the
 * {@link com.questrail.kiosk.payment.transport.DriverService} contract, its
 * results, and {@link com.questrail.kiosk.payment.transport.DriverChannelException}.</p>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Carry requests and replies only (no payment decisions)</li>
 *   <li>Keep framework types (Netty channels, buffers) out of these interfaces</li>
 *   <li>Apply the configured {@link com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy}
 *       to every blocking step</li>
 *   <li>Never retry a call on their own; a pay request is not idempotent</li>
 * </ul>
 */
package com.questrail.kiosk.payment.transport;
