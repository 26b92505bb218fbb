package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;

import java.util.Objects;

/**
 * One call on the driver channel.
 *
 * @param endpoint      name of the endpoint the caller believes it is talking to
 * @param id            caller-assigned correlation id, echoed in the reply
 * @param operation     operation to run
 * @param configuration configuration for {@link DriverOperation#INIT}, otherwise {@code null}
 * @param amount        amount for {@link DriverOperation#PAY}, otherwise {@code 0}
 */
public record DriverRequest(
        String endpoint,
        long id,
        DriverOperation operation,
        RuntimeConfiguration configuration,
        int amount
) {
    public DriverRequest {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(operation, "operation");
    }

    public static DriverRequest init(String endpoint, long id, RuntimeConfiguration configuration) {
        return new DriverRequest(endpoint, id, DriverOperation.INIT, configuration, 0);
    }

    public static DriverRequest test(String endpoint, long id) {
        return new DriverRequest(endpoint, id, DriverOperation.TEST, null, 0);
    }

    public static DriverRequest pay(String endpoint, long id, int amount) {
        return new DriverRequest(endpoint, id, DriverOperation.PAY, null, amount);
    }

    public static DriverRequest shutdown(String endpoint, long id) {
        return new DriverRequest(endpoint, id, DriverOperation.SHUTDOWN, null, 0);
    }
}
