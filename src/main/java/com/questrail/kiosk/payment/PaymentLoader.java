package com.questrail.kiosk.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.kiosk.api.PayDetails;
import com.questrail.kiosk.api.PayRequest;
import com.questrail.kiosk.api.PayResult;
import com.questrail.kiosk.api.PaymentPeripheral;
import com.questrail.kiosk.api.PeripheralStatus;
import com.questrail.kiosk.api.StatusDetails;
import com.questrail.kiosk.payment.config.DriverConfiguration;
import com.questrail.kiosk.payment.config.PaymentFactoryDetails;
import com.questrail.kiosk.payment.config.PaymentJson;
import com.questrail.kiosk.payment.config.PeripheralSetting;
import com.questrail.kiosk.payment.config.RuntimeConfiguration;
import com.questrail.kiosk.payment.config.SettingDataType;
import com.questrail.kiosk.payment.model.DriverResult;
import com.questrail.kiosk.payment.model.OutcomeKind;
import com.questrail.kiosk.payment.model.PaymentOutcome;
import com.questrail.kiosk.payment.model.ResultCode;
import com.questrail.kiosk.payment.supervisor.DriverLaunchSpec;
import com.questrail.kiosk.payment.supervisor.DriverSupervisor;
import com.questrail.kiosk.payment.transport.ChannelTimeoutPolicy;
import com.questrail.kiosk.payment.transport.DriverChannel;
import com.questrail.kiosk.payment.transport.DriverEndpoint;
import com.questrail.kiosk.payment.transport.DriverSession;
import com.questrail.kiosk.payment.transport.netty.NettyDriverChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PaymentLoader
 * =============================================================================
 * Host-side {@link PaymentPeripheral} for the EFT terminal.
 *
 * <p>The loader owns the declared settings and the {@link DriverSupervisor}.
 * Every operation other than settings handling is forwarded to the
 * terminal-driver process through a short-lived {@link DriverSession}.</p>
 *
 * <h2>Declared settings</h2>
 * <ul>
 *   <li>{@code IpAddress} (String): address of the EFT terminal</li>
 *   <li>{@code ForceOnline} (Bool, default {@code False})</li>
 *   <li>{@code PosNumber} (Int, default {@code 1})</li>
 * </ul>
 *
 * <h2>Status</h2>
 * {@link #lastStatus()} starts as {@link PeripheralStatus#NOT_CONFIGURED},
 * follows the outcome of {@code init}, {@code test} and successful payments,
 * and returns to {@code NOT_CONFIGURED} on {@code unload}.
 */
public final class PaymentLoader implements PaymentPeripheral
{
    private static final Logger log = LoggerFactory.getLogger(PaymentLoader.class);

    public static final String DEFAULT_ID = "kiosk-eft";
    public static final String DEFAULT_NAME = DriverConfiguration.DEFAULT_ENDPOINT_NAME;

    private final String id;
    private final DriverSupervisor supervisor;
    private final DriverEndpoint endpoint;
    private final ChannelTimeoutPolicy timeouts;
    private final ObjectMapper mapper = PaymentJson.mapper();
    private final Object lifecycleLock = new Object();

    private volatile PaymentFactoryDetails details;
    private volatile PeripheralStatus lastStatus = PeripheralStatus.NOT_CONFIGURED;

    private PaymentLoader(Builder b) {
        this.id = b.id;
        this.supervisor = b.supervisor;
        this.endpoint = b.endpoint;
        this.timeouts = b.timeouts;
        this.details = new PaymentFactoryDetails(b.id, b.endpoint.name(), b.driverFolderName, declaredSettings());
    }

    static List<PeripheralSetting> declaredSettings() {
        return List.of(
                new PeripheralSetting(SettingDataType.STRING, "IP Address", RuntimeConfiguration.IP_ADDRESS,
                        "", "EFT terminal IP address"),
                new PeripheralSetting(SettingDataType.BOOL, "Force online transaction", RuntimeConfiguration.FORCE_ONLINE,
                        "False", "Force online transaction"),
                new PeripheralSetting(SettingDataType.INT, "POS Number", RuntimeConfiguration.POS_NUMBER,
                        "1", "POS Number")
        );
    }

    @Override
    public String driverId() {
        return id;
    }

    @Override
    public String peripheralName() {
        return endpoint.name();
    }

    @Override
    public PeripheralStatus lastStatus() {
        return lastStatus;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public boolean init() {
        log.info("Initializing payment peripheral {}", endpoint.name());
        synchronized (lifecycleLock) {
            try {
                DriverChannel channel = supervisor.start(endpoint, timeouts);

                RuntimeConfiguration configuration = RuntimeConfiguration.fromSettings(details.currentValues());
                log.info("Runtime configuration: {}", configuration);

                DriverResult result;
                try (DriverSession session = channel.openSession()) {
                    result = session.init(configuration);
                }

                if (result.succeeded()) {
                    lastStatus = PeripheralStatus.OK;
                    log.info("Driver successfully initialized");
                } else {
                    lastStatus = PeripheralStatus.GENERIC_ERROR;
                    log.info("Driver failed to initialize: {} {}", result.code(), result.message());
                }
                return result.succeeded();
            } catch (RuntimeException e) {
                lastStatus = PeripheralStatus.GENERIC_ERROR;
                log.error("Failed to initialize payment driver", e);
                return false;
            } finally {
                log.info("Init finished");
            }
        }
    }

    @Override
    public boolean test() {
        Optional<DriverChannel> channel = supervisor.channel();
        if (channel.isEmpty()) {
            log.debug("Test before init");
            return false;
        }
        if (!supervisor.isDriverAlive()) {
            log.error("Payment driver process is not running");
            lastStatus = PeripheralStatus.GENERIC_ERROR;
            return false;
        }
        try (DriverSession session = channel.get().openSession()) {
            DriverResult result = session.test();
            lastStatus = result.succeeded() ? PeripheralStatus.OK : PeripheralStatus.GENERIC_ERROR;
            if (!result.succeeded()) {
                log.error("Payment driver test returned {}", result.code());
            }
            return result.succeeded();
        } catch (RuntimeException e) {
            lastStatus = PeripheralStatus.GENERIC_ERROR;
            log.error("Failed to test payment driver", e);
            return false;
        }
    }

    @Override
    public PayResult pay(PayRequest request) {
        Objects.requireNonNull(request, "request");
        log.info("Pay started for {} minor units", request.amount());

        Optional<DriverChannel> channel = supervisor.channel();
        if (channel.isEmpty()) {
            log.warn("Pay requested before init");
            return new PayResult(false, PayDetails.none(),
                    new StatusDetails(ResultCode.GENERIC_ERROR.code(), "Payment driver is not initialised"), false);
        }

        boolean sessionOpened = false;
        try (DriverSession session = channel.get().openSession()) {
            sessionOpened = true;
            PaymentOutcome outcome = session.pay(request.amount());

            boolean success = outcome.resultCode() == ResultCode.SUCCESS && outcome.kind() == OutcomeKind.SUCCESSFUL;
            if (success) {
                log.info("Payment succeeded");
                lastStatus = PeripheralStatus.OK;
            } else {
                log.info("Payment failed: {} {}", outcome.resultCode(), outcome.message());
            }
            return new PayResult(success,
                    new PayDetails(outcome.paidAmount(), outcome.customerReceipt()),
                    new StatusDetails(outcome.resultCode().code(), outcome.message()),
                    outcome.uncertain());
        } catch (RuntimeException e) {
            log.error("Payment call failed", e);
            // Once a session is open the request may already have reached the terminal.
            return new PayResult(false, PayDetails.none(),
                    new StatusDetails(ResultCode.GENERIC_ERROR.code(), e.getMessage()), sessionOpened);
        }
    }

    @Override
    public boolean unload() {
        log.info("Unloading payment peripheral {}", endpoint.name());
        synchronized (lifecycleLock) {
            try {
                Optional<DriverChannel> channel = supervisor.channel();
                if (channel.isPresent() && supervisor.isDriverAlive()) {
                    try (DriverSession session = channel.get().openSession()) {
                        session.shutdown();
                    } catch (RuntimeException e) {
                        log.warn("Driver did not accept shutdown, it will be killed", e);
                    }
                }
                supervisor.teardown();
                lastStatus = PeripheralStatus.NOT_CONFIGURED;
                return true;
            } catch (RuntimeException e) {
                log.error("Unload failed", e);
                return false;
            } finally {
                log.info("Unload finished");
            }
        }
    }

    // ---------------------------------------------------------------------
    // Settings
    // ---------------------------------------------------------------------

    @Override
    public boolean updateSettings(String json) {
        log.info("Updating payment settings");
        try {
            PaymentFactoryDetails incoming = mapper.readValue(json, PaymentFactoryDetails.class);
            details = details.withValuesFrom(incoming.configurationSettings());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to update payment settings", e);
            return false;
        }
    }

    @Override
    public String getPaymentFactoryDetails() {
        try {
            return mapper.writeValueAsString(Map.of("Payment", List.of(details)));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    PaymentFactoryDetails details() {
        return details;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id = DEFAULT_ID;
        private DriverSupervisor supervisor;
        private Path driverExecutable;
        private DriverEndpoint endpoint = DriverEndpoint.loopback(DEFAULT_NAME, DriverConfiguration.DEFAULT_PORT);
        private ChannelTimeoutPolicy timeouts = ChannelTimeoutPolicy.defaults();
        private String driverFolderName;

        /**
         * Takes endpoint, timeouts and driver executable from {@code configuration}.
         */
        public Builder withConfiguration(DriverConfiguration configuration) {
            this.endpoint = configuration.endpoint();
            this.timeouts = configuration.timeouts();
            if (configuration.driverExecutable() != null) {
                this.driverExecutable = configuration.driverExecutable();
            }
            return this;
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withSupervisor(DriverSupervisor supervisor) {
            this.supervisor = supervisor;
            return this;
        }

        /**
         * Supervises the driver at {@code executable} with the system process
         * table and a Netty channel. Ignored when a supervisor is supplied.
         */
        public Builder withDriverExecutable(Path executable) {
            this.driverExecutable = executable;
            return this;
        }

        public Builder withEndpoint(DriverEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withTimeouts(ChannelTimeoutPolicy timeouts) {
            this.timeouts = timeouts;
            return this;
        }

        public Builder withDriverFolderName(String name) {
            this.driverFolderName = name;
            return this;
        }

        public PaymentLoader build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(timeouts, "timeouts");
            if (supervisor == null) {
                Objects.requireNonNull(driverExecutable, "driverExecutable or supervisor");
                supervisor = DriverSupervisor.builder()
                        .withLaunchSpec(DriverLaunchSpec.of(driverExecutable))
                        .withChannelOpener(NettyDriverChannel::new)
                        .build();
            }
            if (driverFolderName == null) {
                driverFolderName = driverExecutable != null && driverExecutable.toAbsolutePath().getParent() != null
                        ? String.valueOf(driverExecutable.toAbsolutePath().getParent().getFileName())
                        : "";
            }
            return new PaymentLoader(this);
        }
    }
}
