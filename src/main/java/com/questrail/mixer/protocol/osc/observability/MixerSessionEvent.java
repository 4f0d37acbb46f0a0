package com.questrail.mixer.protocol.osc.observability;

import com.questrail.mixer.api.MixerFamily;

import java.time.Instant;

/**
 * Session-level milestone.
 */
public record MixerSessionEvent(
    Instant timestamp,
    Kind kind,
    String host,
    int port,
    MixerFamily family
) {
    public enum Kind {
        FAMILY_DETECTED,
        KEEPALIVE_STARTED,
        CLOSED
    }
}
