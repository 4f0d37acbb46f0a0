package com.questrail.mixer.api;

import java.util.List;
import java.util.Objects;

/**
 * None of the identification probes was answered within the probe timeout.
 * Session establishment is aborted and not retried.
 */
public final class MixerNotDetectedException extends MixerException
{
    private final List<String> probedAddresses;

    public MixerNotDetectedException(String host, int port, List<String> probedAddresses) {
        super("No mixer answered " + String.join(" or ", probedAddresses)
                + " at " + host + ":" + port + ". Check OSC_HOST and OSC_PORT.");
        this.probedAddresses = List.copyOf(Objects.requireNonNull(probedAddresses, "probedAddresses"));
    }

    /**
     * Identification addresses that were probed, in probe order.
     */
    public List<String> probedAddresses() {
        return probedAddresses;
    }
}
