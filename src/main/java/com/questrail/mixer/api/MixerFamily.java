package com.questrail.mixer.api;

/**
 * MixerFamily
 * -----------------------------------------------------------------------------
 * The OSC dialect spoken by the connected mixer.
 *
 * <p>Both families accept OSC over UDP on the same port and look alike on the
 * surface, but their address grammars, index bases and some value encodings
 * differ. The family is never configured; it is detected once per session by
 * probing each family's identification address.</p>
 */
public enum MixerFamily
{
    /**
     * No detection has succeeded yet for this session.
     */
    UNKNOWN("unknown"),

    /**
     * Full-size consoles (X32 / M32). Identified by {@code /info}.
     */
    X32("x32"),

    /**
     * Reduced rack and compact mixers (XR12 / XR16 / XR18). Identified by
     * {@code /xinfo}.
     */
    X_AIR("x-air");

    private final String label;

    MixerFamily(String label) {
        this.label = label;
    }

    /**
     * Short lower-case label used in status reports and logs.
     */
    public String label() {
        return label;
    }
}
