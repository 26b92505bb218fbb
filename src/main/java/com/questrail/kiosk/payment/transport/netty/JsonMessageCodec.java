package com.questrail.kiosk.payment.transport.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;
import java.util.Objects;

/**
 * JsonMessageCodec
 * -----------------------------------------------------------------------------
 * Maps whole frames to channel messages and back using Jackson.
 *
 * <p>Sits behind the length-field framing handlers: every inbound
 * {@link ByteBuf} is exactly one JSON document of type {@code I}; every
 * outbound {@code O} becomes one frame payload.</p>
 *
 * @param <I> inbound message type
 * @param <O> outbound message type
 */
final class JsonMessageCodec<I, O> extends MessageToMessageCodec<ByteBuf, O>
{
    private final ObjectMapper mapper;
    private final Class<I> inboundType;

    JsonMessageCodec(ObjectMapper mapper, Class<I> inboundType, Class<O> outboundType) {
        super(ByteBuf.class, outboundType);
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.inboundType = Objects.requireNonNull(inboundType, "inboundType");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, O msg, List<Object> out) throws Exception {
        out.add(Unpooled.wrappedBuffer(mapper.writeValueAsBytes(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out) throws Exception {
        // Copy out of the pooled buffer; the codec releases msg after decode.
        byte[] bytes = new byte[msg.readableBytes()];
        msg.readBytes(bytes);
        out.add(mapper.readValue(bytes, inboundType));
    }
}
