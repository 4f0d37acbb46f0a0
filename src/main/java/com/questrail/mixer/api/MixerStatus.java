package com.questrail.mixer.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of session health produced by {@link MixerController#status()}.
 *
 * <p>{@code connected} reflects whether the identification address answered
 * at the time of the call, not merely whether the socket is open. On success
 * {@code info} carries the first argument of the identification reply; on
 * failure {@code error} carries the failure message.</p>
 *
 * @param channels number of input channels of the detected family (0 if unknown)
 * @param buses    number of mix buses
 * @param effects  number of effect slots
 * @param scenes   number of scene slots
 */
public record MixerStatus(
        boolean connected,
        String host,
        int port,
        MixerFamily family,
        int channels,
        int buses,
        int effects,
        int scenes,
        Optional<String> info,
        Optional<String> error
) {
    public MixerStatus {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(error, "error");
    }
}
