package com.questrail.kiosk.payment.supervisor;

import com.questrail.kiosk.payment.observability.RecordingObservabilitySink;
import com.questrail.kiosk.payment.observability.SupervisionEvent.Kind;
import com.questrail.kiosk.payment.time.ManualMonotonicClock;
import com.questrail.kiosk.payment.time.ManualWallClock;
import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverChannel;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.FakeDriverChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DriverSupervisorTest
 * -----------------------------------------------------------------------------
 * Start, readiness and teardown sequencing against a fake process table and a
 * fake channel. Time only moves when the supervisor sleeps.
 */
class DriverSupervisorTest {

    private static final DriverEndpoint ENDPOINT = DriverEndpoint.loopback("KioskEftPayment", 47810);
    private static final ChannelTimeoutPolicy TIMEOUTS = ChannelTimeoutPolicy.defaults();

    private FakeProcessControl processes;
    private ManualMonotonicClock monotonic;
    private RecordingObservabilitySink sink;
    private List<FakeDriverChannel> opened;
    private List<Duration> sleeps;
    private Runnable onSleep;

    private DriverSupervisor supervisor;

    @BeforeEach
    void setUp() {
        processes = new FakeProcessControl();
        monotonic = new ManualMonotonicClock();
        sink = new RecordingObservabilitySink();
        opened = new ArrayList<>();
        sleeps = new ArrayList<>();
        onSleep = () -> {};

        supervisor = DriverSupervisor.builder()
                .withProcessControl(processes)
                .withLaunchSpec(DriverLaunchSpec.of(Path.of("/opt/kiosk/eft/EftDriver.exe")))
                .withChannelOpener((endpoint, timeouts) -> {
                    FakeDriverChannel channel = new FakeDriverChannel(endpoint, timeouts, null);
                    opened.add(channel);
                    return channel;
                })
                .withPolicy(new SupervisorPolicy(Duration.ofSeconds(1), Duration.ofMillis(250)))
                .withMonotonicClock(monotonic)
                .withWallClock(new ManualWallClock(Instant.parse("2026-02-02T12:00:00Z")))
                .withSleeper(d -> {
                    sleeps.add(d);
                    monotonic.advance(d);
                    onSleep.run();
                })
                .withObservabilitySink(sink)
                .build();
    }

    @Test
    void staleInstancesAreKilledBeforeLaunch() {
        FakeDriverProcess stale1 = processes.addRunning("EftDriver");
        FakeDriverProcess stale2 = processes.addRunning("eftdriver");
        FakeDriverProcess unrelated = processes.addRunning("Kiosk");

        DriverChannel channel = supervisor.start(ENDPOINT, TIMEOUTS);

        assertTrue(stale1.wasTerminated());
        assertTrue(stale2.wasTerminated());
        assertFalse(unrelated.wasTerminated());
        assertEquals(1, processes.launches().size());
        assertSame(channel, supervisor.channel().orElseThrow());
        assertTrue(supervisor.isDriverAlive());
        assertEquals(List.of(Kind.STALE_INSTANCE_KILLED, Kind.STALE_INSTANCE_KILLED,
                Kind.DRIVER_LAUNCHED, Kind.CHANNEL_OPENED, Kind.DRIVER_READY), sink.supervisionKinds());
    }

    @Test
    void driverRunsInItsInstallDirectory() {
        supervisor.start(ENDPOINT, TIMEOUTS);

        DriverLaunchSpec launched = processes.launches().get(0);
        assertEquals(Path.of("/opt/kiosk/eft"), launched.workingDirectory());
        assertEquals("EftDriver", launched.processName());
    }

    @Test
    void channelIsOpenedWithTheGivenEndpointAndTimeouts() {
        supervisor.start(ENDPOINT, TIMEOUTS);

        assertEquals(1, opened.size());
        assertEquals(ENDPOINT, opened.get(0).endpoint());
        assertEquals(TIMEOUTS, opened.get(0).timeouts());
    }

    @Test
    void readinessIsPolledUntilTheDriverAnswers() {
        supervisor = rebuildWithProbeAnswers(false, false, true);

        supervisor.start(ENDPOINT, TIMEOUTS);

        assertEquals(3, opened.get(0).probes());
        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(250)), sleeps);
    }

    @Test
    void readinessTimeoutFailsStartAndClosesTheChannel() {
        supervisor = rebuildWithProbeAnswers(false, false, false, false, false, false, false, false);

        ProcessSupervisionException e = assertThrows(ProcessSupervisionException.class,
                () -> supervisor.start(ENDPOINT, TIMEOUTS));

        assertTrue(e.getMessage().contains("did not become ready"));
        assertEquals(5, opened.get(0).probes());
        assertTrue(opened.get(0).isClosed());
        assertTrue(supervisor.channel().isEmpty());
        assertTrue(sink.supervisionKinds().contains(Kind.CHANNEL_CLOSED));
        assertFalse(sink.supervisionKinds().contains(Kind.DRIVER_READY));
        assertTrue(processes.lastLaunched().wasTerminated());
        assertFalse(supervisor.isDriverAlive());
    }

    @Test
    void interruptedReadinessWaitKillsTheDriver() {
        supervisor = DriverSupervisor.builder()
                .withProcessControl(processes)
                .withLaunchSpec(DriverLaunchSpec.of(Path.of("/opt/kiosk/eft/EftDriver.exe")))
                .withChannelOpener((endpoint, timeouts) -> {
                    FakeDriverChannel channel = new FakeDriverChannel(endpoint, timeouts, null).probeAnswers(false);
                    opened.add(channel);
                    return channel;
                })
                .withPolicy(new SupervisorPolicy(Duration.ofSeconds(1), Duration.ofMillis(250)))
                .withMonotonicClock(monotonic)
                .withSleeper(d -> {
                    throw new InterruptedException("stop");
                })
                .withObservabilitySink(sink)
                .build();

        try {
            ProcessSupervisionException e = assertThrows(ProcessSupervisionException.class,
                    () -> supervisor.start(ENDPOINT, TIMEOUTS));

            assertInstanceOf(InterruptedException.class, e.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
            assertTrue(processes.lastLaunched().wasTerminated());
            assertTrue(opened.get(0).isClosed());
            assertFalse(supervisor.isDriverAlive());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void driverExitingDuringReadinessFailsAtOnce() {
        supervisor = rebuildWithProbeAnswers(false, false, false, false, false, false);
        onSleep = () -> processes.lastLaunched().exit();

        ProcessSupervisionException e = assertThrows(ProcessSupervisionException.class,
                () -> supervisor.start(ENDPOINT, TIMEOUTS));

        assertTrue(e.getMessage().contains("exited before becoming ready"));
        assertEquals(1, sleeps.size());
        assertTrue(supervisor.channel().isEmpty());
        assertTrue(sink.supervisionKinds().contains(Kind.DRIVER_EXITED));
    }

    @Test
    void launchFailureIsReportedWithoutOpeningAChannel() {
        processes.failNextStart(new IOException("access denied"));

        ProcessSupervisionException e = assertThrows(ProcessSupervisionException.class,
                () -> supervisor.start(ENDPOINT, TIMEOUTS));

        assertInstanceOf(IOException.class, e.getCause());
        assertTrue(opened.isEmpty());
        assertFalse(supervisor.isDriverAlive());
    }

    @Test
    void aliveFlagDropsWhenTheDriverExits() {
        supervisor.start(ENDPOINT, TIMEOUTS);
        assertTrue(supervisor.isDriverAlive());

        processes.lastLaunched().exit();

        assertFalse(supervisor.isDriverAlive());
        assertEquals(Kind.DRIVER_EXITED, sink.supervisionKinds().get(sink.supervisionKinds().size() - 1));
    }

    @Test
    void teardownClosesTheChannelAndKillsTheDriver() {
        supervisor.start(ENDPOINT, TIMEOUTS);
        FakeDriverProcess driver = processes.lastLaunched();

        supervisor.teardown();

        assertTrue(driver.wasTerminated());
        assertTrue(opened.get(0).isClosed());
        assertTrue(supervisor.channel().isEmpty());
        assertFalse(supervisor.isDriverAlive());
    }

    @Test
    void teardownWithoutStartIsHarmless() {
        assertDoesNotThrow(supervisor::teardown);
        assertTrue(supervisor.channel().isEmpty());
    }

    @Test
    void restartReplacesDriverAndChannel() {
        supervisor.start(ENDPOINT, TIMEOUTS);
        FakeDriverProcess first = processes.lastLaunched();

        supervisor.start(ENDPOINT, TIMEOUTS);

        assertTrue(first.wasTerminated());
        assertTrue(opened.get(0).isClosed());
        assertEquals(2, opened.size());
        assertSame(opened.get(1), supervisor.channel().orElseThrow());
        assertTrue(supervisor.isDriverAlive());
    }

    @Test
    void restartKillsTheLaunchedDriverEvenWhenItCannotBeFoundByName() {
        processes.hideFromLookup();
        supervisor.start(ENDPOINT, TIMEOUTS);
        FakeDriverProcess first = processes.lastLaunched();

        supervisor.start(ENDPOINT, TIMEOUTS);

        assertTrue(first.wasTerminated());
        assertEquals(1, processes.launched().stream().filter(FakeDriverProcess::isAlive).count());
        assertTrue(supervisor.isDriverAlive());
    }

    @Test
    void teardownKillsTheLaunchedDriverEvenWhenItCannotBeFoundByName() {
        processes.hideFromLookup();
        supervisor.start(ENDPOINT, TIMEOUTS);

        supervisor.teardown();

        assertTrue(processes.lastLaunched().wasTerminated());
        assertFalse(supervisor.isDriverAlive());
    }

    private DriverSupervisor rebuildWithProbeAnswers(Boolean... answers) {
        return DriverSupervisor.builder()
                .withProcessControl(processes)
                .withLaunchSpec(DriverLaunchSpec.of(Path.of("/opt/kiosk/eft/EftDriver.exe")))
                .withChannelOpener((endpoint, timeouts) -> {
                    FakeDriverChannel channel = new FakeDriverChannel(endpoint, timeouts, null).probeAnswers(answers);
                    opened.add(channel);
                    return channel;
                })
                .withPolicy(new SupervisorPolicy(Duration.ofSeconds(1), Duration.ofMillis(250)))
                .withMonotonicClock(monotonic)
                .withSleeper(d -> {
                    sleeps.add(d);
                    monotonic.advance(d);
                    onSleep.run();
                })
                .withObservabilitySink(sink)
                .build();
    }
}
