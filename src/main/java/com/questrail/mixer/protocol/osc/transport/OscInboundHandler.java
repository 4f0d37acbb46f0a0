package com.questrail.mixer.protocol.osc.transport;

import com.questrail.mixer.protocol.osc.model.OscMessage;

/**
 * Receives every OSC message decoded from inbound datagrams, in arrival order.
 */
@FunctionalInterface
public interface OscInboundHandler
{
    void onMessage(OscMessage message);
}
