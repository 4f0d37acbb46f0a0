package com.questrail.mixer.protocol.osc.observability;

import java.time.Instant;

/**
 * Transport lifecycle change or datagram-level anomaly.
 *
 * @param cause underlying failure, may be {@code null}
 */
public record MixerTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail,
    Throwable cause
) {
    public enum Kind {
        UP,
        DOWN,
        SEND_FAILED,
        DATAGRAM_DROPPED
    }
}
