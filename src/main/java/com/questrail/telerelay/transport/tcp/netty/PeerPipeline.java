package com.questrail.telerelay.transport.tcp.netty;

import com.questrail.telerelay.protocol.codec.MessageCodec;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Assembles the relay peer pipeline.
 *
 * <pre>
 *   inbound:   bytes ─► frameDecoder ─► messageCodec ─► dispatch
 *   outbound:  dispatch ─► messageCodec ─► framePrepender ─► bytes
 * </pre>
 *
 * Frames carry a 4-byte big-endian length prefix that counts the body only.
 * Bodies above {@code maxFrameLength} fail the connection.
 */
final class PeerPipeline
{
    static final int LENGTH_FIELD_BYTES = 4;

    private PeerPipeline()
    {
    }

    static void install(ChannelPipeline pipeline,
                        MessageCodec codec,
                        int maxFrameLength,
                        EventExecutorGroup dispatchGroup,
                        ConnectionDispatchHandler dispatcher)
    {
        // The decoder's limit counts the length field too.
        pipeline.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(
                maxFrameLength + LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        pipeline.addLast("framePrepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        pipeline.addLast("messageCodec", new RelayMessageCodecHandler(codec));
        // A null group runs the dispatcher on the channel's own event loop.
        pipeline.addLast(dispatchGroup, "dispatch", dispatcher);
    }
}
