package com.questrail.kiosk.payment.runtime;

import com.questrail.kiosk.payment.config.ConfigurationException;
import com.questrail.kiosk.payment.config.DriverConfiguration;
import com.questrail.kiosk.payment.terminal.TerminalApiFactory;
import com.questrail.kiosk.payment.terminal.sim.ScriptedTerminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Entry point of the terminal-driver executable.
 *
 * <p>Loads {@link DriverConfiguration}, resolves the terminal binding and
 * serves until the host sends {@code Shutdown} or the JVM is asked to exit.
 * The binding is the first {@link TerminalApiFactory} registered through
 * {@link ServiceLoader}, or the in-memory {@link ScriptedTerminal} when
 * {@code kiosk.terminal.simulator=true}.</p>
 */
public final class DriverMain
{
    private static final Logger log = LoggerFactory.getLogger(DriverMain.class);

    private DriverMain() {}

    public static void main(String[] args) throws InterruptedException {
        final DriverConfiguration configuration;
        final TerminalApiFactory terminals;
        try {
            configuration = DriverConfiguration.load();
            terminals = resolveTerminals(configuration);
        } catch (ConfigurationException e) {
            log.error("Payment driver not started: {}", e.getMessage(), e);
            System.exit(2);
            return;
        }

        DriverRuntime runtime = DriverRuntime.builder()
                .withConfiguration(configuration)
                .withTerminals(terminals)
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "driver-shutdown"));

        runtime.start();
        runtime.awaitShutdown();
        log.info("Shutdown requested by host");
        runtime.stop();
    }

    static TerminalApiFactory resolveTerminals(DriverConfiguration configuration) {
        if (configuration.simulator()) {
            log.warn("Terminal simulator enabled: no real payments will be taken");
            return new ScriptedTerminal();
        }
        return ServiceLoader.load(TerminalApiFactory.class)
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "No TerminalApiFactory registered; install a terminal binding or set kiosk.terminal.simulator=true"));
    }
}
