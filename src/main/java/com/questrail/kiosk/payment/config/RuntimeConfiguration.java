package com.questrail.kiosk.payment.config;

import java.util.Map;

/**
 * RuntimeConfiguration
 * -----------------------------------------------------------------------------
 * Terminal settings the engine works with between two {@code Init} calls.
 *
 * <p>The record performs no validation: deciding whether a configuration is
 * usable is part of {@code Init}, which rejects it without touching prior
 * state.</p>
 *
 * @param terminalAddress address of the terminal (host or host:port)
 * @param posNumber       point-of-sale number, must be positive to be accepted
 * @param forceOnline     whether every authorization must go online
 */
public record RuntimeConfiguration(String terminalAddress, int posNumber, boolean forceOnline)
{
    public static final String IP_ADDRESS = "IpAddress";
    public static final String POS_NUMBER = "PosNumber";
    public static final String FORCE_ONLINE = "ForceOnline";

    /**
     * Builds a configuration from the peripheral's settings, keyed by real name.
     *
     * @throws ConfigurationException if the POS number is not an integer
     */
    public static RuntimeConfiguration fromSettings(Map<String, String> settings) {
        String address = settings.getOrDefault(IP_ADDRESS, "");
        String pos = settings.getOrDefault(POS_NUMBER, "0");
        String forceOnline = settings.getOrDefault(FORCE_ONLINE, "false");

        final int posNumber;
        try {
            posNumber = Integer.parseInt(pos.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Setting " + POS_NUMBER + " is not a number: " + pos, e);
        }
        return new RuntimeConfiguration(address == null ? "" : address.trim(), posNumber,
                Boolean.parseBoolean(forceOnline == null ? "false" : forceOnline.trim()));
    }
}
