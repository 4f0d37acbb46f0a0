package com.questrail.mixer.api;

import java.util.Objects;

/**
 * Outcome of probing a single wire address with
 * {@link MixerController#verifyAddresses(java.util.List)}.
 *
 * @param value string form of the first reply argument, empty when the address
 *              did not respond
 */
public record AddressProbeResult(String address, Outcome outcome, String value)
{
    public enum Outcome
    {
        RESPONDED,
        TIMEOUT,
        ERROR
    }

    public AddressProbeResult {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(value, "value");
    }

    public boolean responded() {
        return outcome == Outcome.RESPONDED;
    }
}
