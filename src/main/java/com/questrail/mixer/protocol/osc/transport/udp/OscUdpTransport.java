package com.questrail.mixer.protocol.osc.transport.udp;

import com.questrail.mixer.api.MixerConnectionException;
import com.questrail.mixer.protocol.osc.codec.OscPacketDecoder;
import com.questrail.mixer.protocol.osc.codec.OscPacketEncoder;
import com.questrail.mixer.protocol.osc.internal.time.WallClock;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerObservabilitySink;
import com.questrail.mixer.protocol.osc.observability.MixerTransportEvent;
import com.questrail.mixer.protocol.osc.transport.DatagramEndpoint;
import com.questrail.mixer.protocol.osc.transport.DatagramEndpointListener;
import com.questrail.mixer.protocol.osc.transport.OscInboundHandler;
import com.questrail.mixer.protocol.osc.transport.OscSender;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * OscUdpTransport
 * =============================================================================
 * OSC transport bound to one mixer: translates between {@link OscMessage}s and
 * the raw datagrams of a {@link DatagramEndpoint}.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   DatagramEndpoint
 *        → OscPacketDecoder      (bundles flattened, malformed dropped)
 *            → OscInboundHandler (request correlator)
 * </pre>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   OscMessage
 *        → OscPacketEncoder
 *            → DatagramEndpoint.send(mixer, payload)
 * </pre>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class MUST NOT add retries, timing, or correlation. Transport defects
 * are handled as transport defects: undecodable datagrams are dropped and
 * reported to the observability sink, never turned into query failures.
 *
 * <p>Datagrams from any sender are accepted. Mixers answer from their OSC
 * port, but emulators and multi-homed hosts may not.</p>
 */
public class OscUdpTransport implements DatagramEndpointListener, OscSender {

    private final DatagramEndpoint endpoint;
    private final InetSocketAddress mixer;
    private final OscPacketEncoder encoder;
    private final OscPacketDecoder decoder;
    private final OscInboundHandler inbound;
    private final MixerObservabilitySink sink;
    private final WallClock wallClock;

    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile boolean up;

    public OscUdpTransport(DatagramEndpoint endpoint,
                           InetSocketAddress mixer,
                           OscPacketEncoder encoder,
                           OscPacketDecoder decoder,
                           OscInboundHandler inbound,
                           MixerObservabilitySink sink,
                           WallClock wallClock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.mixer = Objects.requireNonNull(mixer, "mixer");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    /**
     * Bind the endpoint. Completion is observed through {@link #ready()}.
     */
    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    /**
     * Completes when the endpoint is bound; fails with
     * {@link MixerConnectionException} if it goes down before that.
     */
    public CompletableFuture<Void> ready() {
        return ready;
    }

    public boolean isUp() {
        return up;
    }

    public InetSocketAddress mixer() {
        return mixer;
    }

    /**
     * Encode and send one message to the mixer. Fire-and-forget.
     *
     * @throws MixerConnectionException if the endpoint is not up
     * @throws IllegalArgumentException if the message cannot be encoded
     */
    @Override
    public void send(OscMessage message) {
        Objects.requireNonNull(message, "message");
        if (!up) {
            throw new MixerConnectionException("OSC transport is not open (sending " + message.address() + ")");
        }

        byte[] payload = encoder.encode(message);
        try {
            endpoint.send(mixer, payload);
        } catch (IllegalStateException e) {
            throw new MixerConnectionException("OSC transport is not open (sending " + message.address() + ")", e);
        }
    }

    public void send(String address, Object... arguments) {
        send(OscMessage.of(address, arguments));
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
        String local = endpoint.localAddress().map(Object::toString).orElse("unbound");
        sink.onTransportEvent(new MixerTransportEvent(
                wallClock.now(), MixerTransportEvent.Kind.UP, local + " -> " + mixer, null));
        ready.complete(null);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        sink.onTransportEvent(new MixerTransportEvent(
                wallClock.now(), MixerTransportEvent.Kind.DOWN, mixer.toString(), cause));
        ready.completeExceptionally(new MixerConnectionException(
                "Failed to open UDP endpoint for " + mixer, cause));
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        List<OscMessage> messages = decoder.decode(payload);
        if (messages.isEmpty()) {
            sink.onTransportEvent(new MixerTransportEvent(
                    wallClock.now(),
                    MixerTransportEvent.Kind.DATAGRAM_DROPPED,
                    payload.length + " bytes from " + remote,
                    null));
            return;
        }

        for (OscMessage message : messages) {
            inbound.onMessage(message);
        }
    }

    @Override
    public void onSendFailed(SocketAddress remote, Throwable cause) {
        sink.onTransportEvent(new MixerTransportEvent(
                wallClock.now(), MixerTransportEvent.Kind.SEND_FAILED, String.valueOf(remote), cause));
    }
}
