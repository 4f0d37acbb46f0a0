package com.questrail.mixer.protocol.osc.codec;

import com.questrail.mixer.protocol.osc.model.OscMessage;

/**
 * OscPacketEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary from an {@link OscMessage} to a wire-ready datagram payload.
 *
 * <p>The returned bytes are sent as-is by the transport. Messages that cannot
 * be serialized (unsupported argument type, oversize) are rejected with
 * {@link IllegalArgumentException}; nothing is sent in that case.</p>
 */
public interface OscPacketEncoder
{
    byte[] encode(OscMessage message);
}
