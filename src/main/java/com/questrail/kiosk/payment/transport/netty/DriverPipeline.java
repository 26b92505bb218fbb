package com.questrail.kiosk.payment.transport.netty;

import com.questrail.kiosk.payment.config.PaymentJson;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * Framing shared by both ends of the driver channel: a 4-byte big-endian
 * length prefix followed by one JSON document.
 */
final class DriverPipeline
{
    static final int MAX_FRAME_BYTES = 1024 * 1024;
    private static final int LENGTH_FIELD_BYTES = 4;

    private DriverPipeline() {}

    static <I, O> void install(ChannelPipeline p, Class<I> inbound, Class<O> outbound) {
        p.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        p.addLast(new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        p.addLast(new JsonMessageCodec<>(PaymentJson.mapper(), inbound, outbound));
    }
}
