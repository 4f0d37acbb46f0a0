package com.questrail.mixer.protocol.osc.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for the single UDP socket a mixer session owns.
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>decoding inbound datagrams into OSC messages</li>
 *   <li>matching replies to pending queries</li>
 *   <li>deciding when to send (queries, mutations, keepalive)</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty or by a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket and begin receiving datagrams.
     *
     * <p>On success the endpoint MUST call
     * {@link DatagramEndpointListener#onTransportUp()} once; a bind failure is
     * reported through {@link DatagramEndpointListener#onTransportDown(Throwable)}
     * with a non-null cause.</p>
     */
    void start();

    /**
     * Close the socket and release all transport resources.
     */
    void stop();

    /**
     * Send one datagram. Fire-and-forget: write failures are reported to
     * {@link DatagramEndpointListener#onSendFailed(SocketAddress, Throwable)}.
     *
     * @param remote  destination (the mixer)
     * @param payload complete datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener for inbound datagrams and lifecycle events. Must be
     * called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * Local address the socket is bound to, once it is up. With an ephemeral
     * bind this is where the actual port number can be read.
     */
    Optional<InetSocketAddress> localAddress();
}
