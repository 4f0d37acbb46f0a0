package com.questrail.mixer.protocol.osc.codec.impl;

import com.illposed.osc.BufferBytesReceiver;
import com.illposed.osc.OSCMessage;
import com.illposed.osc.OSCSerializeException;
import com.illposed.osc.OSCSerializer;
import com.illposed.osc.OSCSerializerAndParserBuilder;
import com.questrail.mixer.protocol.osc.codec.OscPacketEncoder;
import com.questrail.mixer.protocol.osc.model.OscMessage;

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * JavaOscPacketEncoder
 * -----------------------------------------------------------------------------
 * {@link OscPacketEncoder} backed by the JavaOSC serializer.
 *
 * <p>Control messages are tiny (an address and one argument); the buffer is
 * sized for the largest datagram the mixers accept.</p>
 */
public final class JavaOscPacketEncoder implements OscPacketEncoder
{
    static final int MAX_DATAGRAM_BYTES = 8192;

    private final OSCSerializerAndParserBuilder builder = new OSCSerializerAndParserBuilder();

    @Override
    public byte[] encode(OscMessage message)
    {
        Objects.requireNonNull(message, "message");

        ByteBuffer buffer = ByteBuffer.allocate(MAX_DATAGRAM_BYTES);
        OSCSerializer serializer = builder.buildSerializer(new BufferBytesReceiver(buffer));
        try {
            serializer.write(new OSCMessage(message.address(), message.arguments()));
        }
        catch (OSCSerializeException | BufferOverflowException e) {
            throw new IllegalArgumentException("Cannot encode OSC message " + message.address(), e);
        }

        buffer.flip();
        byte[] payload = new byte[buffer.remaining()];
        buffer.get(payload);
        return payload;
    }
}
