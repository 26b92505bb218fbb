package com.questrail.kiosk.payment.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson configuration for settings documents and channel messages.
 *
 * <p>Unknown properties are ignored so that the host and the driver can be
 * upgraded independently. {@link ObjectMapper} is thread-safe once configured.</p>
 */
public final class PaymentJson
{
    private static final ObjectMapper MAPPER = create();

    private PaymentJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
        return mapper;
    }
}
