package com.questrail.mixer.protocol.osc.codec.impl;

import com.illposed.osc.OSCBundle;
import com.illposed.osc.OSCMessage;
import com.illposed.osc.OSCPacket;
import com.illposed.osc.OSCParseException;
import com.illposed.osc.OSCParser;
import com.illposed.osc.OSCSerializerAndParserBuilder;
import com.questrail.mixer.protocol.osc.codec.OscPacketDecoder;
import com.questrail.mixer.protocol.osc.model.OscMessage;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JavaOscPacketDecoder
 * -----------------------------------------------------------------------------
 * {@link OscPacketDecoder} backed by the JavaOSC parser.
 *
 * <p>The parser instance is not documented as thread-safe, so decoding is
 * serialized on this object. In production all calls arrive on the single
 * Netty event loop thread anyway.</p>
 */
public final class JavaOscPacketDecoder implements OscPacketDecoder
{
    private final OSCParser parser = new OSCSerializerAndParserBuilder().buildParser();

    @Override
    public synchronized List<OscMessage> decode(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");
        if (datagram.length == 0) {
            return List.of();
        }

        try {
            OSCPacket packet = parser.convert(ByteBuffer.wrap(datagram));
            List<OscMessage> messages = new ArrayList<>();
            flatten(packet, messages);
            return messages;
        }
        catch (OSCParseException | RuntimeException e) {
            // Wire-level failure → drop datagram
            return List.of();
        }
    }

    private static void flatten(OSCPacket packet, List<OscMessage> out)
    {
        if (packet instanceof OSCMessage message) {
            out.add(new OscMessage(message.getAddress(), message.getArguments()));
        }
        else if (packet instanceof OSCBundle bundle) {
            for (OSCPacket nested : bundle.getPackets()) {
                flatten(nested, out);
            }
        }
    }
}
