package com.questrail.kiosk.payment.internal.engine;

import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.internal.receipt.ReceiptFormatter;
import com.questrail.kiosk.payment.internal.receipt.TicketStore;
import com.questrail.kiosk.payment.internal.receipt.TransactionJournal;
import com.questrail.kiosk.payment.internal.time.SystemWallClock;
import com.questrail.kiosk.payment.internal.time.WallClock;
import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.PaymentOutcome;
import com.questrail.kiosk.payment.model.ResultCode;
import com.questrail.kiosk.payment.model.TransactionRequest;
import com.questrail.kiosk.payment.model.TransactionResponse;
import com.questrail.kiosk.payment.model.TransactionResult;
import com.questrail.kiosk.payment.observability.NullObservabilitySink;
import com.questrail.kiosk.payment.observability.PaymentErrorEvent;
import com.questrail.kiosk.payment.observability.PaymentObservabilitySink;
import com.questrail.kiosk.payment.observability.TransactionStateTransitionEvent;
import com.questrail.kiosk.payment.terminal.TerminalApiFactory;
import com.questrail.kiosk.payment.terminal.TerminalConnection;
import com.questrail.kiosk.payment.terminal.TerminalErrorCode;
import com.questrail.kiosk.payment.terminal.TerminalException;
import com.questrail.kiosk.payment.terminal.TerminalReply;
import com.questrail.kiosk.payment.transport.DriverService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PaymentEngine
 * =============================================================================
 * The transaction engine served inside the terminal-driver process.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>{@code Init}: validate and activate a {@link RuntimeConfiguration}
 *       after a successful connect handshake with the terminal</li>
 *   <li>{@code Test}: report the heartbeat without terminal I/O</li>
 *   <li>{@code Pay}: run one sale through the {@link TransactionState} machine,
 *       including the signature reversal rule, journal persistence and
 *       customer ticket</li>
 *   <li>{@code Shutdown}: stop the heartbeat and release the hosting runtime</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>{@code Init} and {@code Pay} are serialised by one operation lock, so at
 * most one sale is in flight and a configuration never changes under a
 * running sale. {@code Test} and {@code Shutdown} do not take the lock.</p>
 *
 * <h2>Failure policy</h2>
 * <p>No operation throws. Terminal and unexpected failures are mapped to a
 * {@link ResultCode}; persistence and ticket write failures are logged and
 * never change the outcome.</p>
 */
public final class PaymentEngine implements DriverService
{
    private static final Logger log = LoggerFactory.getLogger(PaymentEngine.class);

    private final TerminalApiFactory terminals;
    private final TransactionJournal journal;
    private final TicketStore tickets;
    private final PaymentObservabilitySink sink;
    private final WallClock clock;
    private final ZoneId zone;
    private final Runnable shutdownHook;

    private final EngineContext context;
    private final ReentrantLock operationLock = new ReentrantLock();
    private final AtomicLong transactionIds = new AtomicLong();

    private PaymentEngine(Builder b) {
        this.terminals = b.terminals;
        this.journal = b.journal;
        this.tickets = b.tickets;
        this.sink = b.sink;
        this.clock = b.clock;
        this.zone = b.zone;
        this.shutdownHook = b.shutdownHook;
        this.context = new EngineContext(b.clock);
    }

    // ---------------------------------------------------------------------
    // Init / Test / Shutdown
    // ---------------------------------------------------------------------

    @Override
    public DriverResult init(RuntimeConfiguration configuration) {
        log.info("Init started");
        operationLock.lock();
        try {
            if (configuration == null) {
                log.info("Cannot initialise with no configuration");
                return DriverResult.of(ResultCode.VALIDATION_ERROR, "Configuration is missing");
            }
            log.info("Terminal address: {}", configuration.terminalAddress());
            if (configuration.posNumber() <= 0) {
                log.info("Invalid POS number {}", configuration.posNumber());
                return DriverResult.of(ResultCode.VALIDATION_ERROR,
                        "Invalid POS number " + configuration.posNumber());
            }
            if (configuration.terminalAddress() == null || configuration.terminalAddress().isBlank()) {
                log.info("Invalid terminal address '{}'", configuration.terminalAddress());
                return DriverResult.of(ResultCode.VALIDATION_ERROR, "Terminal address is missing");
            }

            try (TerminalConnection connection = TerminalConnection.open(terminals, configuration.terminalAddress())) {
                TerminalErrorCode connected = connection.connect();
                log.info("Connect result: {}", connected);
                if (!connected.ok()) {
                    return DriverResult.terminal(ResultCode.CONNECT_ERROR, connected,
                            "Could not connect to terminal at " + configuration.terminalAddress());
                }
            }

            context.activate(configuration);
            log.info("Init succeeded");
            return DriverResult.success();
        } catch (RuntimeException e) {
            log.error("Init failed", e);
            sink.onError(new PaymentErrorEvent(clock.now(), "Init failed", e));
            return DriverResult.of(ResultCode.GENERIC_ERROR, describe(e));
        } finally {
            operationLock.unlock();
            log.info("Init finished");
        }
    }

    @Override
    public DriverResult test() {
        Optional<Instant> aliveSince = context.aliveSince();
        log.debug("Test status: {} (alive since {})", aliveSince.isPresent(), aliveSince.orElse(null));
        return aliveSince.isPresent()
                ? DriverResult.success()
                : DriverResult.of(ResultCode.GENERIC_ERROR, "Driver is not initialised");
    }

    @Override
    public DriverResult shutdown() {
        log.info("Shutting down");
        context.deactivate();
        try {
            shutdownHook.run();
        } catch (RuntimeException e) {
            log.error("Shutdown hook failed", e);
            sink.onError(new PaymentErrorEvent(clock.now(), "Shutdown hook failed", e));
            return DriverResult.of(ResultCode.GENERIC_ERROR, describe(e));
        }
        return DriverResult.success();
    }

    // ---------------------------------------------------------------------
    // Pay
    // ---------------------------------------------------------------------

    @Override
    public PaymentOutcome pay(int amount) {
        log.info("Pay started for {} minor units", amount);
        operationLock.lock();
        Attempt attempt = new Attempt(transactionIds.incrementAndGet(), amount);
        try {
            tickets.clear();

            if (amount <= 0) {
                log.info("Invalid pay amount {}", amount);
                return PaymentOutcome.error(ResultCode.VALIDATION_ERROR, "Amount must be positive");
            }
            Optional<RuntimeConfiguration> active = context.configuration();
            if (active.isEmpty()) {
                log.warn("Pay requested before a successful Init");
                return PaymentOutcome.error(ResultCode.GENERIC_ERROR, "Driver is not initialised");
            }
            return authorize(attempt, active.get());
        } catch (IOException e) {
            log.error("Could not remove the pending customer ticket {}", tickets.path(), e);
            sink.onError(new PaymentErrorEvent(clock.now(), "Pending ticket could not be removed", e));
            return PaymentOutcome.error(ResultCode.GENERIC_ERROR, "Pending customer ticket could not be removed");
        } catch (RuntimeException e) {
            log.error("Pay failed", e);
            sink.onError(new PaymentErrorEvent(clock.now(), "Pay failed", e));
            return PaymentOutcome.error(ResultCode.GENERIC_ERROR, describe(e));
        } finally {
            attempt.finish();
            operationLock.unlock();
            log.info("Pay finished");
        }
    }

    private PaymentOutcome authorize(Attempt attempt, RuntimeConfiguration configuration) {
        int amount = attempt.amount;
        try (TerminalConnection connection = TerminalConnection.open(terminals, configuration.terminalAddress())) {
            attempt.moveTo(TransactionState.CONNECTING);
            TerminalErrorCode connected = connection.connect();
            log.info("Connect result: {}", connected);
            if (!connected.ok()) {
                return PaymentOutcome.error(ResultCode.CONNECT_ERROR, connected,
                        "Could not connect to terminal at " + configuration.terminalAddress());
            }
            attempt.moveTo(TransactionState.CONNECTED);

            attempt.moveTo(TransactionState.AUTHORIZING);
            TerminalReply reply = connection.pay(
                    new TransactionRequest(amount, configuration.posNumber(), configuration.forceOnline()));
            log.info("Pay result: {}", reply.code());
            if (!reply.code().ok()) {
                return PaymentOutcome.error(ResultCode.SUBMIT_ERROR, reply.code(),
                        "Terminal rejected the payment request");
            }
            TransactionResponse response = reply.responseIfPresent()
                    .orElseThrow(() -> new TerminalException("Terminal accepted the payment but returned no response"));
            log.info("Pay response status: {}", response.status().receiptText());

            PaymentOutcome outcome = classify(attempt, connection, reply.code(), response);
            disconnect(connection);
            return outcome;
        }
    }

    private PaymentOutcome classify(Attempt attempt,
                                    TerminalConnection connection,
                                    TerminalErrorCode submission,
                                    TransactionResponse response) {
        TransactionResult result = response.result();

        if (result == TransactionResult.FAILED) {
            log.info("Payment failed: {}", response.status().receiptText());
            attempt.moveTo(TransactionState.DECLINED_OR_ERROR);
            persist(attempt, response);
            tickets.write(ReceiptFormatter.FAILURE_NOTICE);
            return PaymentOutcome.failed(response.status().receiptText());
        }

        if (result == TransactionResult.OTHER) {
            log.warn("Terminal returned inconclusive status '{}'", response.transactionStatus());
            attempt.moveTo(TransactionState.DECLINED_OR_ERROR);
            persist(attempt, response);
            return PaymentOutcome.ambiguous(submission,
                    "Inconclusive transaction status: " + response.status().receiptText());
        }

        if (response.entry().requiresSignature()) {
            log.info("Transaction requires a signature, reversing it");
            attempt.moveTo(TransactionState.REVERSAL_REQUIRED);
            return reverse(attempt, connection, response);
        }

        if (response.diagnosticOk() && response.result() == TransactionResult.SUCCESSFUL) {
            log.info("Payment succeeded");
            attempt.moveTo(TransactionState.COMMITTED);
            persist(attempt, response);
            tickets.write(ReceiptFormatter.customerTicket(response, LocalDateTime.ofInstant(clock.now(), zone)));
            return PaymentOutcome.successful(attempt.amount);
        }

        log.warn("Approved transaction not confirmed by the terminal (diagnostic code {})", response.diagnosticCode());
        attempt.moveTo(TransactionState.DECLINED_OR_ERROR);
        persist(attempt, response);
        return PaymentOutcome.unconfirmed(ResultCode.GENERIC_ERROR,
                "Terminal did not confirm the approved transaction");
    }

    private PaymentOutcome reverse(Attempt attempt, TerminalConnection connection, TransactionResponse original) {
        attempt.moveTo(TransactionState.REVERSING);

        TerminalErrorCode reversalCode;
        TransactionResponse persisted = original;
        try {
            TerminalReply reversal = connection.reverse(attempt.amount);
            reversalCode = reversal.code();
            log.info("Reverse result: {}", reversalCode);
            if (reversal.response() != null) {
                log.info("Reverse response status: {}", reversal.response().status().receiptText());
                persisted = reversal.response();
            } else {
                log.warn("Reversal returned no response, journalling the original authorization");
            }
        } catch (RuntimeException e) {
            log.error("Reversal of {} minor units failed", attempt.amount, e);
            sink.onError(new PaymentErrorEvent(clock.now(), "Reversal failed", e));
            reversalCode = TerminalErrorCode.UNKNOWN;
        }

        attempt.moveTo(TransactionState.REVERSED);
        persist(attempt, persisted);
        tickets.write(ReceiptFormatter.FAILURE_NOTICE);
        log.info("Cancelling the transaction");
        return PaymentOutcome.cancelled(reversalCode, "Signature transactions are not accepted");
    }

    private void persist(Attempt attempt, TransactionResponse response) {
        journal.persist(response);
        attempt.moveTo(TransactionState.PERSISTED);
    }

    private static void disconnect(TerminalConnection connection) {
        try {
            TerminalErrorCode disconnected = connection.disconnect();
            log.info("Disconnect result: {}", disconnected);
        } catch (RuntimeException e) {
            log.warn("Disconnect from {} failed", connection.address(), e);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * Tracks the state of one {@code Pay} call and reports its transitions.
     */
    private final class Attempt
    {
        private final long id;
        private final int amount;
        private TransactionState state = TransactionState.IDLE;

        Attempt(long id, int amount) {
            this.id = id;
            this.amount = amount;
        }

        void moveTo(TransactionState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transaction transition " + state + " -> " + next);
            }
            TransactionState previous = state;
            state = next;
            sink.onStateTransition(new TransactionStateTransitionEvent(clock.now(), id, previous, next, amount));
        }

        void finish() {
            if (state != TransactionState.IDLE) {
                moveTo(TransactionState.IDLE);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TerminalApiFactory terminals;
        private TransactionJournal journal;
        private Path journalDirectory;
        private TicketStore tickets;
        private PaymentObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private ZoneId zone = ZoneId.systemDefault();
        private Runnable shutdownHook = () -> {};

        public Builder withTerminals(TerminalApiFactory terminals) {
            this.terminals = terminals;
            return this;
        }

        public Builder withJournal(TransactionJournal journal) {
            this.journal = journal;
            return this;
        }

        public Builder withJournalDirectory(Path directory) {
            this.journalDirectory = directory;
            return this;
        }

        public Builder withTickets(TicketStore tickets) {
            this.tickets = tickets;
            return this;
        }

        public Builder withTicketPath(Path path) {
            this.tickets = new TicketStore(Objects.requireNonNull(path, "path"));
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

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder withShutdownHook(Runnable hook) {
            this.shutdownHook = hook;
            return this;
        }

        public PaymentEngine build() {
            Objects.requireNonNull(terminals, "terminals");
            if (journal == null && journalDirectory != null) {
                journal = new TransactionJournal(journalDirectory, clock, zone);
            }
            Objects.requireNonNull(journal, "journal");
            Objects.requireNonNull(tickets, "tickets");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(shutdownHook, "shutdownHook");
            return new PaymentEngine(this);
        }
    }
}
