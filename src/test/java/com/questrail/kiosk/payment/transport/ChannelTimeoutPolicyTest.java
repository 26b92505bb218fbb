package com.questrail.kiosk.payment.transport;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChannelTimeoutPolicyTest
 * -----------------------------------------------------------------------------
 * Validates timeout bounds and factory methods of the driver channel policy.
 */
class ChannelTimeoutPolicyTest {

    @Test
    void canonicalConstructorAcceptsValidDurations() {
        ChannelTimeoutPolicy policy = new ChannelTimeoutPolicy(
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofMinutes(3),
                Duration.ofSeconds(4)
        );

        assertEquals(Duration.ofSeconds(1), policy.openTimeout());
        assertEquals(Duration.ofSeconds(2), policy.sendTimeout());
        assertEquals(Duration.ofMinutes(3), policy.receiveTimeout());
        assertEquals(Duration.ofSeconds(4), policy.closeTimeout());
    }

    @Test
    void canonicalConstructorRejectsZeroDurations() {
        Duration one = Duration.ofSeconds(1);
        assertThrows(IllegalArgumentException.class, () -> ChannelTimeoutPolicy.uniform(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new ChannelTimeoutPolicy(Duration.ZERO, one, one, one));
        assertThrows(IllegalArgumentException.class, () -> new ChannelTimeoutPolicy(one, Duration.ZERO, one, one));
        assertThrows(IllegalArgumentException.class, () -> new ChannelTimeoutPolicy(one, one, Duration.ZERO, one));
        assertThrows(IllegalArgumentException.class, () -> new ChannelTimeoutPolicy(one, one, one, Duration.ZERO));
    }

    @Test
    void smallestPositiveTimeoutIsAccepted() {
        ChannelTimeoutPolicy policy = ChannelTimeoutPolicy.uniform(Duration.ofMillis(1));

        assertEquals(Duration.ofMillis(1), policy.openTimeout());
        assertEquals(Duration.ofMillis(1), policy.closeTimeout());
    }

    @Test
    void canonicalConstructorRejectsNulls() {
        Duration one = Duration.ofSeconds(1);
        assertThrows(NullPointerException.class, () ->
                new ChannelTimeoutPolicy(null, one, one, one));
        assertThrows(NullPointerException.class, () ->
                new ChannelTimeoutPolicy(one, null, one, one));
        assertThrows(NullPointerException.class, () ->
                new ChannelTimeoutPolicy(one, one, null, one));
        assertThrows(NullPointerException.class, () ->
                new ChannelTimeoutPolicy(one, one, one, null));
    }

    @Test
    void canonicalConstructorRejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () ->
                new ChannelTimeoutPolicy(Duration.ofMillis(-1), Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () ->
                new ChannelTimeoutPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofMillis(-1), Duration.ofSeconds(1)));
    }

    @Test
    void timeoutsAreCappedAtOneDay() {
        assertDoesNotThrow(() -> ChannelTimeoutPolicy.uniform(ChannelTimeoutPolicy.MAX_TIMEOUT));
        assertThrows(IllegalArgumentException.class, () ->
                ChannelTimeoutPolicy.uniform(ChannelTimeoutPolicy.MAX_TIMEOUT.plusMillis(1)));
    }

    @Test
    void defaultsGiveThePayCallTheLongestWait() {
        ChannelTimeoutPolicy policy = ChannelTimeoutPolicy.defaults();

        assertEquals(Duration.ofSeconds(30), policy.openTimeout());
        assertEquals(Duration.ofSeconds(30), policy.sendTimeout());
        assertEquals(Duration.ofMinutes(15), policy.receiveTimeout());
        assertEquals(Duration.ofSeconds(30), policy.closeTimeout());
    }
}
