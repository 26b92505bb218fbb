package com.questrail.kiosk.payment.runtime;

import com.questrail.kiosk.payment.config.DriverConfiguration;
import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.model.PaymentOutcome;
import com.questrail.kiosk.payment.observability.RecordingObservabilitySink;
import com.questrail.kiosk.payment.terminal.sim.ScriptedTerminal;
import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverChannelException;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.DriverSession;
import com.questrail.kiosk.payment.transport.netty.NettyDriverChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DriverRuntimeTest
 * -----------------------------------------------------------------------------
 * The assembled driver process served on an ephemeral loopback port.
 */
class DriverRuntimeTest {

    private static final ChannelTimeoutPolicy TIMEOUTS = ChannelTimeoutPolicy.uniform(Duration.ofSeconds(5));

    @TempDir
    Path dir;

    private RecordingObservabilitySink sink;
    private DriverRuntime runtime;
    private DriverEndpoint bound;

    @BeforeEach
    void setUp() {
        DriverConfiguration configuration = new DriverConfiguration(
                DriverEndpoint.loopback("KioskEftPayment", 0),
                dir.resolve("transactions"),
                dir.resolve("ticket"),
                TIMEOUTS,
                true,
                2,
                null);
        sink = new RecordingObservabilitySink();
        runtime = DriverRuntime.builder()
                .withConfiguration(configuration)
                .withTerminals(new ScriptedTerminal())
                .withObservabilitySink(sink)
                .build();
        runtime.start();
        bound = configuration.endpoint().withPort(runtime.boundAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void servesASaleEndToEnd() throws Exception {
        try (NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS);
             DriverSession session = channel.openSession()) {
            assertTrue(session.init(new RuntimeConfiguration("10.0.0.5", 1, false)).succeeded());

            PaymentOutcome outcome = session.pay(1500);

            assertTrue(outcome.succeeded());
        }

        assertTrue(Files.exists(dir.resolve("ticket")));
        try (var records = Files.list(dir.resolve("transactions"))) {
            assertEquals(1, records.count());
        }
        assertFalse(sink.getStateTransitions().isEmpty());
    }

    @Test
    void remoteShutdownReleasesTheRuntime() throws InterruptedException {
        assertFalse(runtime.awaitShutdown(Duration.ofMillis(50)));

        try (NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS);
             DriverSession session = channel.openSession()) {
            assertTrue(session.shutdown().succeeded());
        }

        assertTrue(runtime.awaitShutdown(Duration.ofSeconds(5)));
        assertFalse(runtime.engine().test().succeeded());
    }

    @Test
    void stopIsIdempotentAndClosesTheEndpoint() {
        runtime.stop();
        runtime.stop();

        try (NettyDriverChannel channel = new NettyDriverChannel(bound, TIMEOUTS)) {
            assertFalse(channel.probe());
            assertThrows(DriverChannelException.class, channel::openSession);
        }
    }
}
