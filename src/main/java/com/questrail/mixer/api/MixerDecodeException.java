package com.questrail.mixer.api;

/**
 * A reply arrived for a query but its argument cannot be converted to the
 * value type of the requested operation (for example a string where a level
 * was expected).
 */
public final class MixerDecodeException extends MixerException
{
    public MixerDecodeException(String message) {
        super(message);
    }
}
