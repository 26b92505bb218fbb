package com.questrail.kiosk.payment.supervisor;

import com.questrail.kiosk.payment.internal.time.MonotonicClock;
import com.questrail.kiosk.payment.internal.time.Sleeper;
import com.questrail.kiosk.payment.internal.time.SystemMonotonicClock;
import com.questrail.kiosk.payment.internal.time.SystemWallClock;
import com.questrail.kiosk.payment.internal.time.ThreadSleeper;
import com.questrail.kiosk.payment.internal.time.WallClock;
import com.questrail.kiosk.payment.observability.NullObservabilitySink;
import com.questrail.kiosk.payment.observability.PaymentObservabilitySink;
import com.questrail.kiosk.payment.observability.SupervisionEvent;
import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverChannel;
import com.questrail.kiosk.payment.transport.DriverChannelOpener;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DriverSupervisor
 * =============================================================================
 * Owns the lifecycle of the out-of-process terminal driver and of the channel
 * the host uses to reach it.
 *
 * <h2>Start sequence</h2>
 * <ol>
 *   <li>{@link #ensureSingleInstance()}: kill every running driver instance and
 *       wait for each to exit</li>
 *   <li>launch a fresh driver in its install directory</li>
 *   <li>open the request/response channel with the configured timeouts</li>
 *   <li>poll the channel until the driver answers or the readiness timeout
 *       expires; fail at once if the driver exits meanwhile</li>
 * </ol>
 * A failed start leaves neither a channel nor a running driver behind.
 *
 * <h2>Failure policy</h2>
 * Nothing is retried. Failures propagate as {@link ProcessSupervisionException}
 * or {@code DriverChannelException}; the host adapter reports them as an
 * initialisation failure.
 *
 * <h2>Thread Safety</h2>
 * Start and teardown are serialised on this instance. {@link #isDriverAlive()}
 * and {@link #channel()} never block.
 */
public final class DriverSupervisor
{
    private static final Logger log = LoggerFactory.getLogger(DriverSupervisor.class);

    private final ProcessControl processes;
    private final DriverLaunchSpec launchSpec;
    private final DriverChannelOpener opener;
    private final SupervisorPolicy policy;
    private final MonotonicClock monotonic;
    private final WallClock wallClock;
    private final Sleeper sleeper;
    private final PaymentObservabilitySink sink;

    private volatile Launched launched;
    private volatile DriverChannel channel;

    private DriverSupervisor(Builder b) {
        this.processes = b.processes;
        this.launchSpec = b.launchSpec;
        this.opener = b.opener;
        this.policy = b.policy;
        this.monotonic = b.monotonic;
        this.wallClock = b.wallClock;
        this.sleeper = b.sleeper;
        this.sink = b.sink;
    }

    /**
     * Runs the full start sequence and returns the ready channel.
     *
     * <p>A supervisor that is already running is torn down first. If the
     * driver does not become ready, the channel is closed and the launched
     * driver is killed before the failure propagates.</p>
     */
    public synchronized DriverChannel start(DriverEndpoint endpoint, ChannelTimeoutPolicy timeouts) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(timeouts, "timeouts");

        closeChannel();
        stopLaunched();
        ensureSingleInstance();
        launch();
        try {
            DriverChannel opened = openChannel(endpoint, timeouts);
            awaitReady(opened);
            return opened;
        } catch (InterruptedException e) {
            ProcessSupervisionException failure = new ProcessSupervisionException("Interrupted while waiting for the driver", e);
            abandon(failure);
            Thread.currentThread().interrupt();
            throw failure;
        } catch (RuntimeException e) {
            abandon(e);
            throw e;
        }
    }

    /**
     * Kills every running driver instance and blocks until each has exited.
     * Finding none is not an error.
     */
    public synchronized void ensureSingleInstance() {
        List<DriverProcess> stale = processes.findByName(launchSpec.processName());
        for (DriverProcess p : stale) {
            log.info("Killing driver instance {} ({})", p.pid(), launchSpec.processName());
            try {
                p.terminateAndWait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProcessSupervisionException("Interrupted while killing driver pid " + p.pid(), e);
            }
            emit(SupervisionEvent.Kind.STALE_INSTANCE_KILLED, "pid " + p.pid());
        }
    }

    /**
     * {@code true} while the launched driver is running. Becomes {@code false}
     * as soon as the process exits, whatever the reason.
     */
    public boolean isDriverAlive() {
        Launched l = launched;
        return l != null && !l.exited.get() && l.process.isAlive();
    }

    /**
     * The channel opened by the last successful {@link #start}, if any.
     */
    public Optional<DriverChannel> channel() {
        return Optional.ofNullable(channel);
    }

    /**
     * Drops the channel and kills the driver, waiting for it to exit.
     */
    public synchronized void teardown() {
        closeChannel();
        stopLaunched();
        ensureSingleInstance();
    }

    /**
     * Kills the driver this supervisor launched, whatever name it runs under.
     * Its children go with it.
     */
    private void stopLaunched() {
        Launched l = launched;
        launched = null;
        if (l == null || !l.process.isAlive()) {
            return;
        }
        log.info("Stopping driver pid {}", l.process.pid());
        try {
            l.process.terminateAndWait();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessSupervisionException("Interrupted while stopping driver pid " + l.process.pid(), e);
        }
    }

    private void abandon(RuntimeException failure) {
        try {
            closeChannel();
        } catch (RuntimeException cleanup) {
            failure.addSuppressed(cleanup);
        }
        try {
            stopLaunched();
        } catch (RuntimeException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    private void launch() {
        final DriverProcess process;
        try {
            process = processes.start(launchSpec);
        } catch (IOException | RuntimeException e) {
            throw new ProcessSupervisionException("Could not launch driver " + launchSpec.executable(), e);
        }
        Launched l = new Launched(process);
        launched = l;
        process.onExit(() -> {
            l.exited.set(true);
            emit(SupervisionEvent.Kind.DRIVER_EXITED, "pid " + process.pid());
        });
        log.info("Launched driver {} as pid {} in {}", launchSpec.executable(), process.pid(), launchSpec.workingDirectory());
        emit(SupervisionEvent.Kind.DRIVER_LAUNCHED, "pid " + process.pid());
    }

    private DriverChannel openChannel(DriverEndpoint endpoint, ChannelTimeoutPolicy timeouts) {
        DriverChannel opened = opener.open(endpoint, timeouts);
        channel = opened;
        emit(SupervisionEvent.Kind.CHANNEL_OPENED, endpoint.toString());
        return opened;
    }

    private void awaitReady(DriverChannel opened) throws InterruptedException {
        Launched l = launched;
        long deadline = monotonic.nowNanos() + policy.readinessTimeout().toNanos();
        while (true) {
            if (l == null || l.exited.get() || !l.process.isAlive()) {
                throw new ProcessSupervisionException("Driver exited before becoming ready");
            }
            if (opened.probe()) {
                emit(SupervisionEvent.Kind.DRIVER_READY, opened.endpoint().toString());
                return;
            }
            if (monotonic.nowNanos() - deadline >= 0) {
                throw new ProcessSupervisionException("Driver did not become ready within "
                        + policy.readinessTimeout());
            }
            sleeper.sleep(policy.pollInterval());
        }
    }

    private void closeChannel() {
        DriverChannel c = channel;
        channel = null;
        if (c != null) {
            try {
                c.close();
            } finally {
                emit(SupervisionEvent.Kind.CHANNEL_CLOSED, c.endpoint().toString());
            }
        }
    }

    private void emit(SupervisionEvent.Kind kind, String detail) {
        sink.onSupervisionEvent(new SupervisionEvent(wallClock.now(), kind, detail));
    }

    private static final class Launched {
        private final DriverProcess process;
        private final AtomicBoolean exited = new AtomicBoolean();

        Launched(DriverProcess process) {
            this.process = process;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProcessControl processes = new SystemProcessControl();
        private DriverLaunchSpec launchSpec;
        private DriverChannelOpener opener;
        private SupervisorPolicy policy = SupervisorPolicy.defaults();
        private MonotonicClock monotonic = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Sleeper sleeper = ThreadSleeper.INSTANCE;
        private PaymentObservabilitySink sink = NullObservabilitySink.INSTANCE;

        public Builder withProcessControl(ProcessControl processes) {
            this.processes = processes;
            return this;
        }

        public Builder withLaunchSpec(DriverLaunchSpec spec) {
            this.launchSpec = spec;
            return this;
        }

        public Builder withChannelOpener(DriverChannelOpener opener) {
            this.opener = opener;
            return this;
        }

        public Builder withPolicy(SupervisorPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonic = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder withObservabilitySink(PaymentObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public DriverSupervisor build() {
            Objects.requireNonNull(processes, "processes");
            Objects.requireNonNull(launchSpec, "launchSpec");
            Objects.requireNonNull(opener, "opener");
            Objects.requireNonNull(policy, "policy");
            Objects.requireNonNull(monotonic, "monotonic");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(sleeper, "sleeper");
            Objects.requireNonNull(sink, "sink");
            return new DriverSupervisor(this);
        }
    }
}
