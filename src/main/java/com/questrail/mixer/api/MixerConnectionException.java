package com.questrail.mixer.api;

/**
 * The UDP endpoint could not be opened, did not come up in time, or is not
 * open when a datagram has to be sent. Fatal for session startup.
 */
public final class MixerConnectionException extends MixerException
{
    public MixerConnectionException(String message) {
        super(message);
    }

    public MixerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
