package com.questrail.mixer.protocol.osc.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. The Netty endpoint delivers them on its
 * single event loop thread.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The socket is bound and usable.
     */
    void onTransportUp();

    /**
     * The socket is unusable.
     *
     * @param cause bind or I/O failure; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * A datagram was received. The payload is a copy owned by the listener and
     * is always a complete datagram.
     */
    void onDatagram(SocketAddress remote, byte[] payload);

    /**
     * An outbound write failed after {@link DatagramEndpoint#send} returned.
     */
    default void onSendFailed(SocketAddress remote, Throwable cause) {
    }
}
