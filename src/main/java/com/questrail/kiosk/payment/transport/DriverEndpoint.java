package com.questrail.kiosk.payment.transport;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Named local endpoint served by the driver process.
 *
 * <p>The name scopes the endpoint to one declared peripheral: requests carry it
 * and a server only answers requests addressed to its own name.</p>
 *
 * @param name peripheral name the endpoint belongs to
 * @param host bind/connect host, normally the loopback address
 * @param port TCP port; {@code 0} lets a server pick an ephemeral port
 */
public record DriverEndpoint(String name, String host, int port)
{
    public static final String LOOPBACK = "127.0.0.1";

    public DriverEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(host, "host");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Endpoint name must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be 0-65535");
        }
    }

    public static DriverEndpoint loopback(String name, int port) {
        return new DriverEndpoint(name, LOOPBACK, port);
    }

    public DriverEndpoint withPort(int newPort) {
        return new DriverEndpoint(name, host, newPort);
    }

    public InetSocketAddress socketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return name + "@" + host + ":" + port;
    }
}
