package com.questrail.mixer.protocol.osc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MixerObservabilitySink that emits logs via SLF4J.
 *
 * <p>Unmatched inbound messages are logged at TRACE: once {@code /xremote} is
 * active the mixer pushes every control change, and almost none of those
 * answer a query.</p>
 */
public final class Slf4jMixerObservabilitySink implements MixerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMixerObservabilitySink.class);

    @Override
    public void onSessionEvent(MixerSessionEvent event) {
        switch (event.kind()) {
            case FAMILY_DETECTED -> log.info("Mixer at {}:{} detected as {}",
                event.host(), event.port(), event.family().label());
            case KEEPALIVE_STARTED -> log.debug("Subscription refresh started for {}:{}",
                event.host(), event.port());
            case CLOSED -> log.info("Mixer session {}:{} closed", event.host(), event.port());
        }
    }

    @Override
    public void onQueryEvent(MixerQueryEvent event) {
        switch (event.outcome()) {
            case TIMED_OUT -> log.debug("Query {} timed out", event.address());
            case UNMATCHED -> log.trace("Unsolicited message {}", event.address());
            default -> log.trace("Query {} {}", event.address(), event.outcome());
        }
    }

    @Override
    public void onTransportEvent(MixerTransportEvent event) {
        switch (event.kind()) {
            case UP -> log.info("OSC UDP endpoint ready: {}", event.detail());
            case DOWN -> log.info("OSC UDP endpoint down: {}", event.detail(), event.cause());
            case SEND_FAILED -> log.warn("OSC send failed: {}", event.detail(), event.cause());
            case DATAGRAM_DROPPED -> log.debug("Dropped undecodable datagram: {}", event.detail());
        }
    }

    @Override
    public void onError(MixerErrorEvent event) {
        log.error("Mixer error: {}", event.message(), event.cause());
    }
}
