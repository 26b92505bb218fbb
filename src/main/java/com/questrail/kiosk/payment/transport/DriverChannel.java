package com.questrail.kiosk.payment.transport;

/**
 * DriverChannel
 * -----------------------------------------------------------------------------
 * Reusable factory for call sessions to one driver endpoint.
 *
 * <p>A channel is held for the whole lifetime of the peripheral. It owns the
 * client-side transport resources; individual sessions own only their own
 * connection.</p>
 */
public interface DriverChannel extends AutoCloseable
{
    DriverEndpoint endpoint();

    ChannelTimeoutPolicy timeouts();

    /**
     * Opens a new call session.
     *
     * @throws DriverChannelException if the endpoint cannot be reached within the open timeout
     */
    DriverSession openSession();

    /**
     * Cheap reachability check: {@code true} if a connection to the endpoint can
     * be established right now. Never throws.
     */
    boolean probe();

    /**
     * Releases transport resources. Sessions still open are not usable afterwards.
     */
    @Override
    void close();
}
