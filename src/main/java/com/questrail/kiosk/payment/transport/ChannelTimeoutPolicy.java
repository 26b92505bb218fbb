package com.questrail.kiosk.payment.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * ChannelTimeoutPolicy
 * -----------------------------------------------------------------------------
 * Timeouts applied by the driver channel.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>openTimeout</b>: maximum time to establish a session connection.</li>
 *   <li><b>sendTimeout</b>: maximum time to hand a request to the transport.</li>
 *   <li><b>receiveTimeout</b>: maximum time to wait for a reply. A pay call
 *       waits for the customer at the terminal, so this is the long one.</li>
 *   <li><b>closeTimeout</b>: maximum time to wait for a session to close.</li>
 * </ul>
 *
 * <p>Every value must be positive and no longer than {@link #MAX_TIMEOUT}; a
 * zero timeout would fail every call at once. A peripheral can sit idle for hours between sales, but a
 * call that never returns must eventually surface as a failure.</p>
 */
public record ChannelTimeoutPolicy(
        Duration openTimeout,
        Duration sendTimeout,
        Duration receiveTimeout,
        Duration closeTimeout
) {
    public static final Duration MAX_TIMEOUT = Duration.ofDays(1);

    public ChannelTimeoutPolicy {
        check(openTimeout, "openTimeout");
        check(sendTimeout, "sendTimeout");
        check(receiveTimeout, "receiveTimeout");
        check(closeTimeout, "closeTimeout");
    }

    private static void check(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        if (value.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException(name + " must not exceed " + MAX_TIMEOUT);
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>openTimeout: 30s</li>
     *   <li>sendTimeout: 30s</li>
     *   <li>receiveTimeout: 15min</li>
     *   <li>closeTimeout: 30s</li>
     * </ul>
     */
    public static ChannelTimeoutPolicy defaults() {
        return new ChannelTimeoutPolicy(
                Duration.ofSeconds(30),
                Duration.ofSeconds(30),
                Duration.ofMinutes(15),
                Duration.ofSeconds(30)
        );
    }

    /**
     * The same value for all four timeouts.
     */
    public static ChannelTimeoutPolicy uniform(Duration timeout) {
        return new ChannelTimeoutPolicy(timeout, timeout, timeout, timeout);
    }
}
