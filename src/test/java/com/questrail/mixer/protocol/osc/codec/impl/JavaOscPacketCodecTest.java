package com.questrail.mixer.protocol.osc.codec.impl;

import com.illposed.osc.BufferBytesReceiver;
import com.illposed.osc.OSCBundle;
import com.illposed.osc.OSCMessage;
import com.illposed.osc.OSCPacket;
import com.illposed.osc.OSCSerializerAndParserBuilder;
import com.questrail.mixer.protocol.osc.model.OscMessage;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaOscPacketCodecTest {

    private final JavaOscPacketEncoder encoder = new JavaOscPacketEncoder();
    private final JavaOscPacketDecoder decoder = new JavaOscPacketDecoder();

    @Test
    void queryWithoutArgumentsIsPaddedAddressPlusEmptyTypeTags() {
        byte[] payload = encoder.encode(OscMessage.of("/xinfo"));

        // "/xinfo\0\0" + ",\0\0\0"
        assertEquals(12, payload.length);
        assertEquals("/xinfo", new String(payload, 0, 6, StandardCharsets.US_ASCII));
        assertEquals(',', payload[8]);
    }

    @Test
    void mixedArgumentsSurviveTheWire() {
        OscMessage sent = OscMessage.of("/ch/01/config/name", "Vocals");
        List<OscMessage> received = decoder.decode(encoder.encode(sent));

        assertEquals(List.of(sent), received);

        OscMessage level = decoder.decode(encoder.encode(OscMessage.of("/ch/01/mix/fader", 0.75))).get(0);
        assertEquals(0.75f, level.arguments().get(0));

        OscMessage index = decoder.decode(encoder.encode(OscMessage.of("/-snap/load", 12))).get(0);
        assertEquals(12, index.arguments().get(0));
    }

    @Test
    void bundlesAreFlattenedInOrder() throws Exception {
        OSCBundle bundle = new OSCBundle(List.<OSCPacket>of(
                new OSCMessage("/ch/01/mix/fader", List.of(0.5f)),
                new OSCBundle(List.<OSCPacket>of(new OSCMessage("/ch/02/mix/on", List.of(1))))
        ));
        ByteBuffer buffer = ByteBuffer.allocate(1024);
        new OSCSerializerAndParserBuilder().buildSerializer(new BufferBytesReceiver(buffer)).write(bundle);
        buffer.flip();
        byte[] payload = new byte[buffer.remaining()];
        buffer.get(payload);

        List<OscMessage> messages = decoder.decode(payload);

        assertEquals(2, messages.size());
        assertEquals("/ch/01/mix/fader", messages.get(0).address());
        assertEquals("/ch/02/mix/on", messages.get(1).address());
        assertEquals(1, messages.get(1).arguments().get(0));
    }

    @Test
    void malformedDatagramsDecodeToNothing() {
        assertTrue(decoder.decode(new byte[0]).isEmpty());
        assertTrue(decoder.decode(new byte[] {1, 2, 3}).isEmpty());
        assertTrue(decoder.decode("not osc at all".getBytes(StandardCharsets.US_ASCII)).isEmpty());
    }

    @Test
    void unsupportedArgumentTypeIsRejected() {
        OscMessage message = new OscMessage("/ch/01/mix/fader", List.of(new Object()));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(message));
    }
}
