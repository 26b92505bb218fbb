package com.questrail.kiosk.payment.runtime;

import com.questrail.kiosk.payment.config.DriverConfiguration;
import com.questrail.kiosk.payment.internal.engine.PaymentEngine;
import com.questrail.kiosk.payment.internal.time.SystemWallClock;
import com.questrail.kiosk.payment.internal.time.WallClock;
import com.questrail.kiosk.payment.observability.PaymentObservabilitySink;
import com.questrail.kiosk.payment.observability.Slf4jPaymentObservabilitySink;
import com.questrail.kiosk.payment.terminal.TerminalApiFactory;
import com.questrail.kiosk.payment.transport.DriverService;
import com.questrail.kiosk.payment.transport.netty.NettyDriverServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DriverRuntime
 * =============================================================================
 * Composition root and lifecycle owner of the terminal-driver process.
 *
 * <p>Wires the {@link PaymentEngine} to the configured terminal binding,
 * journal and ticket paths, and serves it on the driver endpoint. A remote
 * {@code Shutdown} releases {@link #awaitShutdown()}; the caller then invokes
 * {@link #stop()}.</p>
 */
public final class DriverRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(DriverRuntime.class);

    private static final Duration WORKER_DRAIN = Duration.ofSeconds(5);

    private final DriverConfiguration configuration;
    private final PaymentEngine engine;
    private final ExecutorService workers;
    private final NettyDriverServer server;
    private final CountDownLatch shutdownRequested = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean();

    private DriverRuntime(Builder b) {
        this.configuration = b.configuration;
        this.engine = PaymentEngine.builder()
                .withTerminals(b.terminals)
                .withJournalDirectory(b.configuration.journalDirectory())
                .withTicketPath(b.configuration.ticketPath())
                .withObservabilitySink(b.sink)
                .withClock(b.clock)
                .withShutdownHook(shutdownRequested::countDown)
                .build();
        this.workers = Executors.newFixedThreadPool(b.configuration.workers(), new WorkerThreadFactory());
        this.server = new NettyDriverServer(b.configuration.endpoint(), engine, workers);
    }

    public void start() {
        server.start();
        log.info("Payment driver ready on {} (journal {}, ticket {})",
                server.boundAddress(), configuration.journalDirectory(), configuration.ticketPath());
    }

    /**
     * Blocks until a remote {@code Shutdown} is received.
     */
    public void awaitShutdown() throws InterruptedException {
        shutdownRequested.await();
    }

    /**
     * Like {@link #awaitShutdown()} but gives up after {@code timeout}.
     *
     * @return {@code true} if shutdown was requested
     */
    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        return shutdownRequested.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Drains in-flight calls, then closes the endpoint. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        // Drain before closing: an in-flight Shutdown reply must still be written.
        workers.shutdown();
        try {
            if (!workers.awaitTermination(WORKER_DRAIN.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            server.close();
        }
        log.info("Payment driver stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public InetSocketAddress boundAddress() {
        return server.boundAddress();
    }

    public DriverService engine() {
        return engine;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DriverConfiguration configuration;
        private TerminalApiFactory terminals;
        private PaymentObservabilitySink sink = new Slf4jPaymentObservabilitySink();
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withConfiguration(DriverConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder withTerminals(TerminalApiFactory terminals) {
            this.terminals = terminals;
            return this;
        }

        public Builder withObservabilitySink(PaymentObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public DriverRuntime build() {
            Objects.requireNonNull(configuration, "configuration");
            Objects.requireNonNull(terminals, "terminals");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(clock, "clock");
            return new DriverRuntime(this);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "driver-call-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
