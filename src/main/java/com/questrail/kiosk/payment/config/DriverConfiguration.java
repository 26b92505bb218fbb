package com.questrail.kiosk.payment.config;

import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverEndpoint;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * DriverConfiguration
 * =============================================================================
 * Application configuration of the terminal-driver process and of the host
 * adapter that launches it.
 *
 * <h2>Sources</h2>
 * {@link #load()} reads {@code driver.properties} from the working directory,
 * or the file named by the {@code kiosk.driver.config} system property, then
 * overlays every {@code kiosk.*} system property. Missing keys take defaults.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>{@code kiosk.endpoint.name} (default {@value #DEFAULT_ENDPOINT_NAME})</li>
 *   <li>{@code kiosk.endpoint.host} (default {@code 127.0.0.1})</li>
 *   <li>{@code kiosk.endpoint.port} (default {@value #DEFAULT_PORT})</li>
 *   <li>{@code kiosk.journal.dir} (default {@code transactions})</li>
 *   <li>{@code kiosk.ticket.path} (default {@code ticket})</li>
 *   <li>{@code kiosk.channel.open-timeout}, {@code send-timeout},
 *       {@code receive-timeout}, {@code close-timeout} (ISO-8601 durations)</li>
 *   <li>{@code kiosk.terminal.simulator} (default {@code false})</li>
 *   <li>{@code kiosk.workers} (default {@value #DEFAULT_WORKERS})</li>
 *   <li>{@code kiosk.driver.executable} (host side only, no default)</li>
 * </ul>
 */
public record DriverConfiguration(
        DriverEndpoint endpoint,
        Path journalDirectory,
        Path ticketPath,
        ChannelTimeoutPolicy timeouts,
        boolean simulator,
        int workers,
        Path driverExecutable
) {
    public static final String CONFIG_FILE_PROPERTY = "kiosk.driver.config";
    public static final String DEFAULT_CONFIG_FILE = "driver.properties";

    public static final String DEFAULT_ENDPOINT_NAME = "KioskEftPayment";
    public static final int DEFAULT_PORT = 47810;
    public static final int DEFAULT_WORKERS = 4;

    static final String PREFIX = "kiosk.";
    static final String ENDPOINT_NAME = "kiosk.endpoint.name";
    static final String ENDPOINT_HOST = "kiosk.endpoint.host";
    static final String ENDPOINT_PORT = "kiosk.endpoint.port";
    static final String JOURNAL_DIR = "kiosk.journal.dir";
    static final String TICKET_PATH = "kiosk.ticket.path";
    static final String OPEN_TIMEOUT = "kiosk.channel.open-timeout";
    static final String SEND_TIMEOUT = "kiosk.channel.send-timeout";
    static final String RECEIVE_TIMEOUT = "kiosk.channel.receive-timeout";
    static final String CLOSE_TIMEOUT = "kiosk.channel.close-timeout";
    static final String SIMULATOR = "kiosk.terminal.simulator";
    static final String WORKERS = "kiosk.workers";
    static final String DRIVER_EXECUTABLE = "kiosk.driver.executable";

    public DriverConfiguration {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(journalDirectory, "journalDirectory");
        Objects.requireNonNull(ticketPath, "ticketPath");
        Objects.requireNonNull(timeouts, "timeouts");
        if (workers < 1) {
            throw new ConfigurationException(WORKERS + " must be at least 1, was " + workers);
        }
    }

    /**
     * Loads the configuration from the default sources.
     *
     * @throws ConfigurationException if the file cannot be read or a value is invalid
     */
    public static DriverConfiguration load() {
        Properties props = new Properties();
        Path file = Path.of(System.getProperty(CONFIG_FILE_PROPERTY, DEFAULT_CONFIG_FILE));
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read driver configuration " + file, e);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX) && !key.equals(CONFIG_FILE_PROPERTY)) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    /**
     * Builds a configuration from {@code props}; missing keys take defaults.
     *
     * @throws ConfigurationException if a value cannot be parsed or is out of range
     */
    public static DriverConfiguration fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        ChannelTimeoutPolicy defaults = ChannelTimeoutPolicy.defaults();

        final DriverEndpoint endpoint;
        final ChannelTimeoutPolicy timeouts;
        try {
            endpoint = new DriverEndpoint(
                    props.getProperty(ENDPOINT_NAME, DEFAULT_ENDPOINT_NAME).trim(),
                    props.getProperty(ENDPOINT_HOST, DriverEndpoint.LOOPBACK).trim(),
                    intValue(props, ENDPOINT_PORT, DEFAULT_PORT));
            timeouts = new ChannelTimeoutPolicy(
                    duration(props, OPEN_TIMEOUT, defaults.openTimeout()),
                    duration(props, SEND_TIMEOUT, defaults.sendTimeout()),
                    duration(props, RECEIVE_TIMEOUT, defaults.receiveTimeout()),
                    duration(props, CLOSE_TIMEOUT, defaults.closeTimeout()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid driver configuration: " + e.getMessage(), e);
        }

        String executable = props.getProperty(DRIVER_EXECUTABLE);
        return new DriverConfiguration(
                endpoint,
                Path.of(props.getProperty(JOURNAL_DIR, "transactions").trim()),
                Path.of(props.getProperty(TICKET_PATH, "ticket").trim()),
                timeouts,
                Boolean.parseBoolean(props.getProperty(SIMULATOR, "false").trim()),
                intValue(props, WORKERS, DEFAULT_WORKERS),
                executable == null || executable.isBlank() ? null : Path.of(executable.trim()));
    }

    public static DriverConfiguration defaults() {
        return fromProperties(new Properties());
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + raw, e);
        }
    }

    private static Duration duration(Properties props, String key, Duration defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key + " is not an ISO-8601 duration: " + raw, e);
        }
    }
}
