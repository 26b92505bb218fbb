package com.questrail.kiosk.payment.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * {@link ProcessControl} backed by {@link ProcessHandle} and {@link ProcessBuilder}.
 *
 * <p>Launched drivers run non-interactively: standard output and error are
 * discarded and standard input is empty. Terminating a driver also kills the
 * processes it started.</p>
 */
public final class SystemProcessControl implements ProcessControl
{
    private static final Logger log = LoggerFactory.getLogger(SystemProcessControl.class);

    @Override
    public List<DriverProcess> findByName(String processName) {
        long self = ProcessHandle.current().pid();
        return ProcessHandle.allProcesses()
                .filter(p -> p.pid() != self)
                .filter(p -> executableName(p).map(processName::equalsIgnoreCase).orElse(false))
                .map(HandleProcess::new)
                .collect(Collectors.toList());
    }

    @Override
    public DriverProcess start(DriverLaunchSpec spec) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(spec.command())
                .directory(spec.workingDirectory().toFile())
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = builder.start();
        log.debug("Started {} as pid {}", spec.command(), process.pid());
        return new HandleProcess(process.toHandle());
    }

    private static Optional<String> executableName(ProcessHandle handle) {
        Optional<String> command = handle.info().command();
        if (command.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(DriverLaunchSpec.baseName(Path.of(command.get())));
        } catch (InvalidPathException e) {
            log.trace("Ignoring process {} with unparseable command {}", handle.pid(), command.get());
            return Optional.empty();
        }
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name", "").startsWith("Windows") ? "NUL" : "/dev/null");
    }

    private static final class HandleProcess implements DriverProcess
    {
        private final ProcessHandle handle;

        HandleProcess(ProcessHandle handle) {
            this.handle = handle;
        }

        @Override
        public long pid() {
            return handle.pid();
        }

        @Override
        public boolean isAlive() {
            return handle.isAlive();
        }

        /**
         * Kills the process and every descendant it spawned, so a launcher
         * script takes its real driver with it.
         */
        @Override
        public void terminateAndWait() throws InterruptedException {
            List<ProcessHandle> children = handle.descendants().collect(Collectors.toList());
            if (handle.isAlive()) {
                handle.destroyForcibly();
            }
            for (ProcessHandle child : children) {
                if (child.isAlive()) {
                    log.debug("Killing pid {} started by driver pid {}", child.pid(), handle.pid());
                    child.destroyForcibly();
                }
            }
            awaitExit(handle);
            for (ProcessHandle child : children) {
                awaitExit(child);
            }
        }

        private static void awaitExit(ProcessHandle process) throws InterruptedException {
            try {
                process.onExit().get();
            } catch (ExecutionException e) {
                throw new ProcessSupervisionException("Waiting for pid " + process.pid() + " to exit failed", e.getCause());
            }
        }

        @Override
        public void onExit(Runnable callback) {
            handle.onExit().thenRun(callback);
        }

        @Override
        public String toString() {
            return "pid " + handle.pid();
        }
    }
}
