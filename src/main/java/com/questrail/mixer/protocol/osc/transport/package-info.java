/**
 * Mixer Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the framework-agnostic boundary between a concrete
 * UDP implementation (Netty, or a test fake) and the OSC session core.</p>
 *
 * <p>Everything above the endpoint sees only:</p>
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Endpoint implementations perform I/O only. They do not decode OSC, match
 * replies to queries, schedule timeouts or send keepalives.
 */
package com.questrail.mixer.protocol.osc.transport;
