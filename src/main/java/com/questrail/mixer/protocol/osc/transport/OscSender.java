package com.questrail.mixer.protocol.osc.transport;

import com.questrail.mixer.protocol.osc.model.OscMessage;

/**
 * Outbound side of an OSC transport bound to one mixer.
 */
@FunctionalInterface
public interface OscSender
{
    /**
     * Send one message. Fire-and-forget: returning means the datagram was
     * handed to the socket, not that the mixer received it.
     */
    void send(OscMessage message);
}
