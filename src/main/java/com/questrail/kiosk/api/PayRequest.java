package com.questrail.kiosk.api;

/**
 * A sale requested by the platform.
 *
 * @param amount amount in minor currency units
 */
public record PayRequest(int amount) {}
