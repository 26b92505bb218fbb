package com.questrail.kiosk.payment.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The peripheral's factory description: identity plus declared settings.
 */
public record PaymentFactoryDetails(
        @JsonProperty("Id") String id,
        @JsonProperty("PaymentName") String paymentName,
        @JsonProperty("DriverFolderName") String driverFolderName,
        @JsonProperty("ConfigurationSettings") List<PeripheralSetting> configurationSettings
) {
    public PaymentFactoryDetails {
        configurationSettings = configurationSettings == null
                ? List.of()
                : configurationSettings.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Returns a copy in which every setting whose real name appears in
     * {@code updates} takes the updated current value. Unknown and missing
     * names are ignored.
     */
    public PaymentFactoryDetails withValuesFrom(List<PeripheralSetting> updates) {
        Objects.requireNonNull(updates, "updates");
        Map<String, String> values = updates.stream()
                .filter(s -> s.realName() != null)
                .collect(Collectors.toMap(PeripheralSetting::realName, PeripheralSetting::currentValue, (a, b) -> b));

        List<PeripheralSetting> merged = configurationSettings.stream()
                .map(s -> values.containsKey(s.realName()) ? s.withCurrentValue(values.get(s.realName())) : s)
                .toList();
        return new PaymentFactoryDetails(id, paymentName, driverFolderName, merged);
    }

    /**
     * Current values keyed by real name.
     */
    public Map<String, String> currentValues() {
        return configurationSettings.stream()
                .filter(s -> s.realName() != null)
                .collect(Collectors.toMap(PeripheralSetting::realName, PeripheralSetting::currentValue, (a, b) -> b));
    }
}
