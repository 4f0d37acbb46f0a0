package com.questrail.mixer.api;

import java.time.Duration;
import java.util.Objects;

/**
 * A query received no reply within its timeout. Recoverable: the session stays
 * usable and the caller may reissue the query.
 */
public final class MixerQueryTimeoutException extends MixerException
{
    private final String address;
    private final Duration timeout;

    public MixerQueryTimeoutException(String address, Duration timeout) {
        super("Timeout waiting for response from " + address + " after " + timeout.toMillis() + " ms");
        this.address = Objects.requireNonNull(address, "address");
        this.timeout = timeout;
    }

    public String address() {
        return address;
    }

    public Duration timeout() {
        return timeout;
    }
}
