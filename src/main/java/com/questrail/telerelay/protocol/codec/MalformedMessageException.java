package com.questrail.telerelay.protocol.codec;

/**
 * Indicates that a frame body could not be translated into a valid
 * {@link com.questrail.telerelay.protocol.model.RelayMessage}, or that a
 * decoded message is not legal at this point of the conversation.
 *
 * This typically reflects:
 * <ul>
 *   <li>Payload that is not a JSON object</li>
 *   <li>Missing or unknown {@code type} discriminator</li>
 *   <li>Missing required field or a field of the wrong JSON type</li>
 *   <li>A message other than {@code hello} before the handshake</li>
 * </ul>
 *
 * A malformed message terminates the connection it arrived on.
 */
public final class MalformedMessageException extends RuntimeException
{
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
