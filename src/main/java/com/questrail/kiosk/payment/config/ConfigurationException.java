package com.questrail.kiosk.payment.config;

/**
 * Indicates a configuration value that cannot be used: unparseable, out of
 * range, or missing where no default exists.
 */
public final class ConfigurationException extends RuntimeException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
