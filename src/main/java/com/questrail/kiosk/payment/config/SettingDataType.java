package com.questrail.kiosk.payment.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Editor type the host settings screen uses for a peripheral setting.
 */
public enum SettingDataType
{
    @JsonProperty("String") STRING,
    @JsonProperty("Bool") BOOL,
    @JsonProperty("Int") INT,
    @JsonProperty("SerialPortSelection") SERIAL_PORT_SELECTION
}
