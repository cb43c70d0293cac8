/**
 * Peer Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP in production, fakes
 * in tests) and the relay wiring.
 *
 * <h2>Why these ports exist</h2>
 * The relay uses Netty for its event loops, stream framing and lifecycle
 * handling <strong>without</strong> letting Netty types leak into the relay
 * core. Everything above the transport adapter sees only:
 * <ul>
 *   <li>decoded {@link com.questrail.telerelay.protocol.model.RelayMessage}s</li>
 *   <li>{@link com.questrail.telerelay.core.peer.PeerConnection} handles</li>
 *   <li>accept and close notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>frame every message explicitly on the stream</li>
 *   <li>perform transport I/O only (no handshake or relay semantics)</li>
 *   <li>report decode failures as the close cause of the affected connection</li>
 * </ul>
 */
package com.questrail.telerelay.transport;
