package com.questrail.telerelay.protocol.codec;

import com.questrail.telerelay.protocol.model.RelayMessage;

/**
 * MessageCodec
 * -----------------------------------------------------------------------------
 * Payload-level codec for {@link RelayMessage}s.
 *
 * <p>The codec operates on the body of exactly one frame. It is
 * <strong>not</strong> responsible for framing: locating message boundaries on
 * the stream is the transport's job (length-prefix framing, see
 * {@code transport.tcp.netty}).</p>
 */
public interface MessageCodec
{
    /**
     * Encode a message into one frame body.
     *
     * @param message message to encode
     * @return UTF-8 encoded payload
     */
    byte[] encode(RelayMessage message);

    /**
     * Decode one complete frame body.
     *
     * @param payload the bytes of exactly one frame
     * @return the decoded message
     * @throws MalformedMessageException if the payload is not a valid message
     */
    RelayMessage decode(byte[] payload);
}
