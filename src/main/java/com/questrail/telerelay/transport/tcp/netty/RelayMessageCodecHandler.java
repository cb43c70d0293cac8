package com.questrail.telerelay.transport.tcp.netty;

import com.questrail.telerelay.protocol.codec.MessageCodec;
import com.questrail.telerelay.protocol.model.RelayMessage;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;
import java.util.Objects;

/**
 * Converts between whole frame payloads and {@link RelayMessage}s.
 *
 * <p>Sits above the length-field framer, so every inbound buffer is exactly
 * one message body. Decode failures propagate as
 * {@link io.netty.handler.codec.DecoderException} wrapping the codec's
 * {@link com.questrail.telerelay.protocol.codec.MalformedMessageException}.</p>
 */
final class RelayMessageCodecHandler extends MessageToMessageCodec<ByteBuf, RelayMessage>
{
    private final MessageCodec codec;

    RelayMessageCodecHandler(MessageCodec codec)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, RelayMessage msg, List<Object> out)
    {
        out.add(Unpooled.wrappedBuffer(codec.encode(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out)
    {
        // Copy out of the reference-counted buffer (Netty containment rule).
        out.add(codec.decode(ByteBufUtil.getBytes(msg)));
    }
}
