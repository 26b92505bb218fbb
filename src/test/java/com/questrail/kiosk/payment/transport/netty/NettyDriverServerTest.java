package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.PaymentOutcome;
import com.questrail.kiosk.payment.model.ResultCode;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.DriverService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dispatch rules of the server, exercised without opening a socket.
 */
class NettyDriverServerTest {

    private final RecordingService service = new RecordingService();
    private final ExecutorService workers = Executors.newSingleThreadExecutor();
    private final NettyDriverServer server =
            new NettyDriverServer(DriverEndpoint.loopback("KioskEftPayment", 0), service, workers);

    @AfterEach
    void tearDown() {
        server.close();
        workers.shutdownNow();
    }

    @Test
    void requestsAreRoutedByOperation() {
        RuntimeConfiguration config = new RuntimeConfiguration("10.0.0.5", 1, false);

        assertTrue(server.dispatch(DriverRequest.init("KioskEftPayment", 1, config)).result().succeeded());
        assertTrue(server.dispatch(DriverRequest.test("KioskEftPayment", 2)).result().succeeded());
        assertEquals(700, server.dispatch(DriverRequest.pay("KioskEftPayment", 3, 700)).outcome().paidAmount());
        assertTrue(server.dispatch(DriverRequest.shutdown("KioskEftPayment", 4)).result().succeeded());

        assertEquals(List.of("init 10.0.0.5", "test", "pay 700", "shutdown"), service.calls);
    }

    @Test
    void replyEchoesTheRequestId() {
        assertEquals(42, server.dispatch(DriverRequest.test("KioskEftPayment", 42)).id());
    }

    @Test
    void requestsForAnotherEndpointNeverReachTheService() {
        DriverReply reply = server.dispatch(DriverRequest.pay("OtherPayment", 5, 100));

        assertTrue(reply.failed());
        assertTrue(reply.error().contains("is not served here"));
        assertTrue(service.calls.isEmpty());
    }

    @Test
    void serviceExceptionsBecomeFailureReplies() {
        service.failNext = true;

        DriverReply reply = server.dispatch(DriverRequest.test("KioskEftPayment", 6));

        assertTrue(reply.failed());
        assertEquals("boom", reply.error());
    }

    @Test
    void boundAddressRequiresStart() {
        assertThrows(IllegalStateException.class, server::boundAddress);
    }

    private static final class RecordingService implements DriverService {
        final List<String> calls = new ArrayList<>();
        boolean failNext;

        @Override
        public DriverResult init(RuntimeConfiguration configuration) {
            calls.add("init " + configuration.terminalAddress());
            return DriverResult.success();
        }

        @Override
        public DriverResult test() {
            if (failNext) {
                throw new IllegalStateException("boom");
            }
            calls.add("test");
            return DriverResult.success();
        }

        @Override
        public PaymentOutcome pay(int amount) {
            calls.add("pay " + amount);
            return PaymentOutcome.successful(amount);
        }

        @Override
        public DriverResult shutdown() {
            calls.add("shutdown");
            return DriverResult.of(ResultCode.SUCCESS, "bye");
        }
    }
}
