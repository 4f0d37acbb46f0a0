package com.questrail.mixer.protocol.osc.observability;

import java.time.Instant;

/**
 * Error or anomaly in the mixer session core.
 */
public record MixerErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
