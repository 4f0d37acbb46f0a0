package com.questrail.mixer.protocol.osc.transport;

import com.questrail.mixer.protocol.osc.codec.impl.JavaOscPacketDecoder;
import com.questrail.mixer.protocol.osc.codec.impl.JavaOscPacketEncoder;
import com.questrail.mixer.protocol.osc.model.OscMessage;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint} implementation.
 *
 * <p>Stores outbound datagrams and lets tests inject inbound ones. It can also
 * play a scripted mixer: when a query (a message without arguments) is sent
 * to an address registered with {@link #answer(String, Object)}, the reply is
 * delivered synchronously from inside {@link #send}. Mutations and unknown
 * addresses get no reply, like a real console.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {}

    public static final InetSocketAddress MIXER = new InetSocketAddress("127.0.0.1", 10024);
    private static final InetSocketAddress LOCAL = new InetSocketAddress("127.0.0.1", 50123);

    private final JavaOscPacketDecoder decoder = new JavaOscPacketDecoder();
    private final JavaOscPacketEncoder encoder = new JavaOscPacketEncoder();

    private DatagramEndpointListener listener;
    private final List<Sent> sent = new ArrayList<>();
    private final Map<String, Object> answers = new HashMap<>();
    private boolean up;
    private boolean failOnStart;

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener == null) {
            return;
        }
        if (failOnStart) {
            listener.onTransportDown(new BindException("Address already in use"));
            return;
        }
        up = true;
        listener.onTransportUp();
    }

    @Override
    public void stop() {
        up = false;
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (!up) {
            throw new IllegalStateException("UDP endpoint is not bound");
        }
        sent.add(new Sent(remote, payload));

        for (OscMessage message : decoder.decode(payload)) {
            Object answer;
            synchronized (answers) {
                answer = message.arguments().isEmpty() ? answers.get(message.address()) : null;
            }
            if (answer != null) {
                reply(OscMessage.of(message.address(), answer));
            }
        }
    }

    @Override
    public Optional<InetSocketAddress> localAddress() {
        return up ? Optional.of(LOCAL) : Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Answer queries to {@code address} with {@code value}.
     */
    public FakeDatagramEndpoint answer(String address, Object value) {
        synchronized (answers) {
            answers.put(address, value);
        }
        return this;
    }

    public FakeDatagramEndpoint failOnStart() {
        this.failOnStart = true;
        return this;
    }

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onDatagram(remote, payload);
    }

    /**
     * Deliver {@code message} as if the mixer had sent it.
     */
    public void reply(OscMessage message) {
        injectDatagram(MIXER, encoder.encode(message));
    }

    public List<Sent> sent() {
        return Collections.unmodifiableList(sent);
    }

    /**
     * Outbound datagrams decoded back into messages, in send order.
     */
    public List<OscMessage> sentMessages() {
        List<OscMessage> out = new ArrayList<>();
        for (Sent s : sent) {
            out.addAll(decoder.decode(s.payload()));
        }
        return out;
    }

    public List<String> sentAddresses() {
        return sentMessages().stream().map(OscMessage::address).toList();
    }

    public void clear() {
        sent.clear();
    }
}
