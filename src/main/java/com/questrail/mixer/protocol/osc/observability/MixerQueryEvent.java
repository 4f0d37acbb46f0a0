package com.questrail.mixer.protocol.osc.observability;

import java.time.Instant;

/**
 * Query lifecycle step for one wire address.
 */
public record MixerQueryEvent(
    Instant timestamp,
    String address,
    Outcome outcome
) {
    public enum Outcome {
        SENT,
        SHARED,
        RESOLVED,
        TIMED_OUT,
        UNMATCHED
    }
}
