package com.questrail.kiosk.payment.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One configurable setting declared to the host platform.
 *
 * <p>Property names follow the host's settings document. An incoming setting
 * may lack a real name; such entries match nothing when merged.</p>
 */
public record PeripheralSetting(
        @JsonProperty("ControlType") SettingDataType controlType,
        @JsonProperty("ControlName") String controlName,
        @JsonProperty("RealName") String realName,
        @JsonProperty("CurrentValue") String currentValue,
        @JsonProperty("ControlDescription") String controlDescription
) {
    public PeripheralSetting {
        currentValue = currentValue == null ? "" : currentValue;
    }

    public PeripheralSetting withCurrentValue(String value) {
        return new PeripheralSetting(controlType, controlName, realName, value, controlDescription);
    }
}
