package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.internal.engine.PaymentEngine;
import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.EntryMethod;
import com.questrail.kiosk.payment.model.OutcomeKind;
import com.questrail.kiosk.payment.model.PaymentOutcome;
import com.questrail.kiosk.payment.model.ResultCode;
import com.questrail.kiosk.payment.terminal.TerminalReply;
import com.questrail.kiosk.payment.terminal.sim.ScriptedTerminal;
import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverChannelException;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.DriverService;
import com.questrail.kiosk.payment.transport.DriverSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyDriverChannelIntegrationTest
 * -----------------------------------------------------------------------------
 * Runs the client channel against a real server on an ephemeral loopback port.
 */
class NettyDriverChannelIntegrationTest {

    private static final String NAME = "KioskEftPayment";
    private static final ChannelTimeoutPolicy TIMEOUTS = ChannelTimeoutPolicy.uniform(Duration.ofSeconds(5));

    @TempDir
    Path dir;

    private ScriptedTerminal terminal;
    private ExecutorService workers;
    private NettyDriverServer server;
    private DriverEndpoint bound;

    @BeforeEach
    void setUp() {
        terminal = new ScriptedTerminal();
        PaymentEngine engine = PaymentEngine.builder()
                .withTerminals(terminal)
                .withJournalDirectory(dir.resolve("transactions"))
                .withTicketPath(dir.resolve("ticket"))
                .build();
        workers = Executors.newFixedThreadPool(2);
        server = startServer(engine);
    }

    @AfterEach
    void tearDown() {
        server.close();
        workers.shutdownNow();
    }

    @Test
    void callsRoundTripThroughTheEngine() {
        try (NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS);
             DriverSession session = channel.openSession()) {

            assertEquals(ResultCode.GENERIC_ERROR, session.test().code());

            DriverResult init = session.init(new RuntimeConfiguration("10.0.0.5", 1, false));
            assertTrue(init.succeeded());
            assertTrue(session.test().succeeded());

            PaymentOutcome paid = session.pay(2500);
            assertEquals(OutcomeKind.SUCCESSFUL, paid.kind());
            assertEquals(2500, paid.paidAmount());
            assertTrue(paid.customerReceipt());
        }
    }

    @Test
    void reversedSaleCrossesTheWireIntact() {
        terminal.onPay(TerminalReply.of(ScriptedTerminal.approved(1000, EntryMethod.SWIPE)));

        try (NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS)) {
            try (DriverSession session = channel.openSession()) {
                session.init(new RuntimeConfiguration("10.0.0.5", 1, false));
            }
            try (DriverSession session = channel.openSession()) {
                PaymentOutcome outcome = session.pay(1000);
                assertEquals(OutcomeKind.CANCELLED, outcome.kind());
                assertEquals(ResultCode.TRANSACTION_CANCELLED, outcome.resultCode());
                assertEquals(0, outcome.paidAmount());
                assertFalse(outcome.uncertain());
            }
        }
    }

    @Test
    void callsToAnotherEndpointNameAreRejected() {
        DriverEndpoint stranger = new DriverEndpoint("OtherPayment", bound.host(), bound.port());

        try (NettyDriverChannel channel = new NettyDriverChannel(stranger, TIMEOUTS);
             DriverSession session = channel.openSession()) {
            DriverChannelException e = assertThrows(DriverChannelException.class, session::test);
            assertTrue(e.getMessage().contains("is not served here"));
        }
        assertEquals(0, terminal.sessionsCreated());
    }

    @Test
    void probeFollowsServerAndChannelLifecycle() {
        NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS);
        assertTrue(channel.probe());

        channel.close();
        assertFalse(channel.probe());
        assertThrows(DriverChannelException.class, channel::openSession);
    }

    @Test
    void probeIsFalseWhenNothingListens() {
        server.close();

        try (NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS)) {
            assertFalse(channel.probe());
            assertThrows(DriverChannelException.class, channel::openSession);
        }
    }

    @Test
    void slowReplyExceedsTheReceiveTimeout() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        server.close();
        server = startServer(new BlockingService(release));

        ChannelTimeoutPolicy shortReceive = new ChannelTimeoutPolicy(
                Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofMillis(200), Duration.ofSeconds(5));
        try (NettyDriverChannel channel = new NettyDriverChannel(bound, shortReceive);
             DriverSession session = channel.openSession()) {
            DriverChannelException e = assertThrows(DriverChannelException.class, () -> session.pay(100));
            assertTrue(e.getMessage().contains("Timed out"));
        } finally {
            release.countDown();
        }
    }

    private NettyDriverServer startServer(DriverService service) {
        NettyDriverServer s = new NettyDriverServer(DriverEndpoint.loopback(NAME, 0), service, workers);
        s.start();
        bound = s.endpoint().withPort(s.boundAddress().getPort());
        return s;
    }

    private static final class BlockingService implements DriverService {
        private final CountDownLatch release;

        BlockingService(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public DriverResult init(RuntimeConfiguration configuration) {
            return DriverResult.success();
        }

        @Override
        public DriverResult test() {
            return DriverResult.success();
        }

        @Override
        public PaymentOutcome pay(int amount) {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return PaymentOutcome.successful(amount);
        }

        @Override
        public DriverResult shutdown() {
            return DriverResult.success();
        }
    }
}
