package com.questrail.kiosk.api;

/**
 * Peripheral health as last observed by the host adapter.
 */
public enum PeripheralStatus
{
    OK(0, "Peripheral OK"),
    GENERIC_ERROR(1, "Peripheral generic error"),
    NOT_CONFIGURED(2, "Peripheral not configured");

    private final int code;
    private final String description;

    PeripheralStatus(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}
