package com.questrail.kiosk.api;

/**
 * Peripheral-specific status of a payment attempt.
 *
 * @param statusCode  numeric result code
 * @param description human-readable description
 */
public record StatusDetails(int statusCode, String description)
{
    public StatusDetails {
        description = description == null ? "" : description;
    }
}
