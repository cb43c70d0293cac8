/**
 * Wire codec for the peer channels.
 * =============================================================================
 *
 * <p>Each message is one UTF-8 JSON object. On the stream every JSON object is
 * carried in its own frame, prefixed by a 4-byte big-endian length:</p>
 *
 * <pre>
 *   TCP stream
 *        → length-prefix frame decoder   (transport.tcp.netty)
 *            → byte[] frame body
 *                → MessageCodec.decode   (this package)
 *                    → RelayMessage
 * </pre>
 *
 * <p>Sending one JSON object per write and reading a fixed-size buffer per
 * receive is not a framing scheme: a stream transport may split or coalesce
 * writes. The explicit length prefix is mandatory.</p>
 *
 * <h2>Message types</h2>
 * <ul>
 *   <li>{@code hello}: {@code id}, {@code role}</li>
 *   <li>{@code sensor_data}: {@code voltage}, {@code status}, {@code gps}, {@code timestamp}</li>
 *   <li>{@code command}: {@code request_id}, {@code voltage}, {@code status}</li>
 *   <li>{@code actuator_status}: {@code request_id} (optional), {@code t2}, {@code t3},
 *       {@code voltage_set} (optional), {@code gps} (optional)</li>
 * </ul>
 */
package com.questrail.telerelay.protocol.codec;
