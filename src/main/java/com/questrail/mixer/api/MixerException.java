package com.questrail.mixer.api;

/**
 * Base type for failures raised by the mixer control core.
 *
 * <p>All failures are unchecked. Asynchronous queries complete their future
 * exceptionally with one of the subclasses; blocking helpers rethrow it.</p>
 */
public class MixerException extends RuntimeException
{
    public MixerException(String message) {
        super(message);
    }

    public MixerException(String message, Throwable cause) {
        super(message, cause);
    }
}
