package com.questrail.mixer.protocol.osc.profile;

/**
 * Conversion between a human value and the single OSC argument the mixer
 * stores for a control.
 *
 * <p>{@link #encode} clamps out-of-range input to the nearest bound before
 * converting; it never rejects a value. {@link #decode} inverts the
 * conversion, up to the device's own quantization.</p>
 *
 * @param <H> human value type
 */
public interface EncodingRule<H> {

    /**
     * @return a {@link Float}, {@link Integer} or {@link String} wire argument
     */
    Object encode(H value);

    /**
     * @throws com.questrail.mixer.api.MixerDecodeException if the wire argument
     *         has the wrong type for this rule
     */
    H decode(Object wire);
}
