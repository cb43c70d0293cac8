package com.questrail.telerelay.protocol.model;

/**
 * Canonical semantic representation of a message exchanged on a peer channel.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code RelayMessage} is the only form of message that the relay core reasons
 * about. Wire concerns (JSON field names, length-prefix framing, Netty buffers)
 * are resolved before an instance is created and after one is handed to the
 * transport.
 * </p>
 *
 * <h2>Directionality</h2>
 * <ul>
 *   <li>{@link Hello}: any agent to relay, first message on a connection</li>
 *   <li>{@link TelemetryPacket}: measurement agent to relay</li>
 *   <li>{@link Command}: relay to actuation agent</li>
 *   <li>{@link Acknowledgement}: actuation agent to relay</li>
 * </ul>
 */
public sealed interface RelayMessage
        permits Hello, TelemetryPacket, Command, Acknowledgement
{
}
