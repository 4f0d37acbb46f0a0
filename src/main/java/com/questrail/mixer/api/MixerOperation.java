package com.questrail.mixer.api;

import java.util.Objects;

/**
 * MixerOperation
 * -----------------------------------------------------------------------------
 * A logical, family-independent mixer control such as "channel fader" or
 * "EQ band gain".
 *
 * <h2>Human units</h2>
 * The type parameter is the value type callers work with: levels and dB as
 * {@link Double}, switches as {@link Boolean}, selectors as {@link Integer},
 * names as {@link String}. Conversion to the device's wire representation is
 * the job of the family profile bound to the session; callers never see wire
 * values or wire indices.
 *
 * <h2>Placeholder</h2>
 * When an operation has no equivalent on the connected family, queries
 * complete with {@link #placeholder()} instead of contacting the device.
 *
 * <p>Instances are identity constants; the set below is closed.</p>
 *
 * @param <H> human value type
 */
public final class MixerOperation<H>
{
    // Channel strip
    public static final MixerOperation<Double> CHANNEL_FADER = level("channel.fader");
    public static final MixerOperation<Boolean> CHANNEL_MUTE = flag("channel.mute");
    public static final MixerOperation<Double> CHANNEL_PAN = level("channel.pan");
    public static final MixerOperation<String> CHANNEL_NAME = text("channel.name");
    public static final MixerOperation<Integer> CHANNEL_COLOR = selector("channel.color");
    public static final MixerOperation<Integer> CHANNEL_SOURCE = selector("channel.source");

    // Preamp low cut
    public static final MixerOperation<Boolean> LOW_CUT_ON = flag("lowcut.on");
    public static final MixerOperation<Double> LOW_CUT_FREQUENCY = level("lowcut.frequency");

    // EQ (indexed by channel, band)
    public static final MixerOperation<Boolean> EQ_ON = flag("eq.on");
    public static final MixerOperation<Double> EQ_GAIN = level("eq.gain");
    public static final MixerOperation<Double> EQ_FREQUENCY = level("eq.frequency");
    public static final MixerOperation<Double> EQ_Q = level("eq.q");
    public static final MixerOperation<Integer> EQ_TYPE = selector("eq.type");

    // Gate
    public static final MixerOperation<Boolean> GATE_ON = flag("gate.on");
    public static final MixerOperation<Double> GATE_THRESHOLD = level("gate.threshold");
    public static final MixerOperation<Double> GATE_RANGE = level("gate.range");
    public static final MixerOperation<Double> GATE_ATTACK = level("gate.attack");
    public static final MixerOperation<Double> GATE_HOLD = level("gate.hold");
    public static final MixerOperation<Double> GATE_RELEASE = level("gate.release");

    // Compressor
    public static final MixerOperation<Boolean> COMPRESSOR_ON = flag("compressor.on");
    public static final MixerOperation<Double> COMPRESSOR_THRESHOLD = level("compressor.threshold");
    public static final MixerOperation<Double> COMPRESSOR_RATIO = level("compressor.ratio");
    public static final MixerOperation<Double> COMPRESSOR_ATTACK = level("compressor.attack");
    public static final MixerOperation<Double> COMPRESSOR_RELEASE = level("compressor.release");
    public static final MixerOperation<Double> COMPRESSOR_KNEE = level("compressor.knee");
    public static final MixerOperation<Double> COMPRESSOR_GAIN = level("compressor.gain");

    // Mix buses
    public static final MixerOperation<Double> BUS_FADER = level("bus.fader");
    public static final MixerOperation<Boolean> BUS_MUTE = flag("bus.mute");
    public static final MixerOperation<Double> BUS_PAN = level("bus.pan");
    public static final MixerOperation<String> BUS_NAME = text("bus.name");

    // Sends (indexed by channel, bus or effect)
    public static final MixerOperation<Double> SEND_LEVEL = level("send.level");
    public static final MixerOperation<Boolean> SEND_PRE_FADER = flag("send.prefader");
    public static final MixerOperation<Double> FX_SEND_LEVEL = level("send.fx.level");

    // Main stereo mix
    public static final MixerOperation<Double> MAIN_FADER = level("main.fader");
    public static final MixerOperation<Boolean> MAIN_MUTE = flag("main.mute");
    public static final MixerOperation<Double> MAIN_PAN = level("main.pan");

    // Outputs that exist only on full-size consoles
    public static final MixerOperation<Double> AUX_FADER = level("aux.fader");
    public static final MixerOperation<Boolean> AUX_MUTE = flag("aux.mute");
    public static final MixerOperation<Double> MATRIX_FADER = level("matrix.fader");
    public static final MixerOperation<Boolean> MATRIX_MUTE = flag("matrix.mute");

    // Effects rack
    public static final MixerOperation<Boolean> EFFECT_ON = flag("effect.on");
    public static final MixerOperation<Double> EFFECT_MIX = level("effect.mix");
    public static final MixerOperation<Double> EFFECT_PARAM = level("effect.param");

    private final String name;
    private final H placeholder;

    private MixerOperation(String name, H placeholder) {
        this.name = Objects.requireNonNull(name, "name");
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
    }

    private static MixerOperation<Double> level(String name) {
        return new MixerOperation<>(name, 0.0);
    }

    private static MixerOperation<Boolean> flag(String name) {
        return new MixerOperation<>(name, Boolean.FALSE);
    }

    private static MixerOperation<Integer> selector(String name) {
        return new MixerOperation<>(name, 0);
    }

    private static MixerOperation<String> text(String name) {
        return new MixerOperation<>(name, "");
    }

    public String name() {
        return name;
    }

    /**
     * Value returned by queries when the operation is unsupported by the
     * connected family.
     */
    public H placeholder() {
        return placeholder;
    }

    @Override
    public String toString() {
        return "MixerOperation[" + name + "]";
    }
}
