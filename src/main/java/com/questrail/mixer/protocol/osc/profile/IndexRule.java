package com.questrail.mixer.protocol.osc.profile;

import java.util.Locale;
import java.util.Objects;

/**
 * How one human index (channel, bus, band, scene, ...) becomes part of a wire
 * address or argument on a given family.
 *
 * @param name      index name used in error messages
 * @param min       lowest accepted human index
 * @param max       highest accepted human index
 * @param wireShift added to the human index to obtain the wire index
 *                  ({@code -1} for zero-based addressing)
 * @param padWidth  zero-pad width in addresses; {@code 0} for no padding
 */
public record IndexRule(String name, int min, int max, int wireShift, int padWidth) {

    public IndexRule {
        Objects.requireNonNull(name, "name");
        if (min > max) {
            throw new IllegalArgumentException(name + ": min > max");
        }
        if (padWidth < 0) {
            throw new IllegalArgumentException(name + ": padWidth must be >= 0");
        }
    }

    public static IndexRule padded(String name, int count, int padWidth) {
        return new IndexRule(name, 1, count, 0, padWidth);
    }

    public static IndexRule plain(String name, int count) {
        return new IndexRule(name, 1, count, 0, 0);
    }

    public int count() {
        return max - min + 1;
    }

    /**
     * @throws IllegalArgumentException if {@code human} is outside {@code min..max}
     */
    public int toWire(int human) {
        if (human < min || human > max) {
            throw new IllegalArgumentException(
                    name + " " + human + " out of range " + min + ".." + max);
        }
        return human + wireShift;
    }

    public String format(int human) {
        int wire = toWire(human);
        if (padWidth == 0) {
            return Integer.toString(wire);
        }
        return String.format(Locale.ROOT, "%0" + padWidth + "d", wire);
    }
}
