package com.questrail.mixer.protocol.osc.codec;

import com.questrail.mixer.protocol.osc.model.OscMessage;

import java.util.List;

/**
 * OscPacketDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between a raw UDP payload and {@link OscMessage}s.
 *
 * <p>The decoder treats each call as exactly one complete datagram. A plain
 * message yields a single element; a bundle yields its messages in order,
 * nested bundles flattened.</p>
 *
 * <p>Malformed payloads are transport defects: the decoder returns an empty
 * list and never throws for bad input.</p>
 */
public interface OscPacketDecoder
{
    List<OscMessage> decode(byte[] datagram);
}
