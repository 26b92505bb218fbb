package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.PaymentOutcome;

/**
 * Answer to a {@link DriverRequest}.
 *
 * <p>Exactly one of {@code result}, {@code outcome} or {@code error} is set:
 * {@code outcome} for pay calls, {@code result} for the other operations, and
 * {@code error} when the server could not run the call at all.</p>
 */
public record DriverReply(long id, DriverResult result, PaymentOutcome outcome, String error)
{
    public static DriverReply of(long id, DriverResult result) {
        return new DriverReply(id, result, null, null);
    }

    public static DriverReply of(long id, PaymentOutcome outcome) {
        return new DriverReply(id, null, outcome, null);
    }

    public static DriverReply failure(long id, String error) {
        return new DriverReply(id, null, null, error == null ? "Unknown failure" : error);
    }

    public boolean failed() {
        return error != null;
    }
}
