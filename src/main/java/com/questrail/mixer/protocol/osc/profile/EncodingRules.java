package com.questrail.mixer.protocol.osc.profile;

import com.questrail.mixer.api.MixerDecodeException;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Encoding rules shared by both mixer families.
 *
 * <p>Most controls are stored by the mixer as a float in 0.0..1.0. The rules
 * below map human units onto that range:</p>
 * <ul>
 *   <li>fader and send levels: pass-through (0.75 = 0 dB)</li>
 *   <li>mute: inverted, the wire control is "on" (1 = unmuted)</li>
 *   <li>pan: -1..1 → (p+1)/2</li>
 *   <li>EQ gain: -15..15 dB → (g+15)/30</li>
 *   <li>frequency: 20..20000 Hz, logarithmic</li>
 *   <li>gate threshold: -80..0 dB → (t+80)/80</li>
 *   <li>compressor threshold: -60..0 dB → (t+60)/60</li>
 *   <li>compressor ratio: 1..20 → (r-1)/19</li>
 *   <li>low cut: 20..400 Hz, logarithmic</li>
 * </ul>
 */
public final class EncodingRules {

    public static final EncodingRule<Double> LEVEL = linear(0.0, 1.0, 0.0, 1.0);
    public static final EncodingRule<Double> UNIT = LEVEL;
    public static final EncodingRule<Double> PAN = linear(-1.0, 1.0, 1.0, 2.0);
    public static final EncodingRule<Double> EQ_GAIN = linear(-15.0, 15.0, 15.0, 30.0);
    public static final EncodingRule<Double> GATE_THRESHOLD = linear(-80.0, 0.0, 80.0, 80.0);
    public static final EncodingRule<Double> COMPRESSOR_THRESHOLD = linear(-60.0, 0.0, 60.0, 60.0);
    public static final EncodingRule<Double> COMPRESSOR_RATIO = linear(1.0, 20.0, -1.0, 19.0);
    public static final EncodingRule<Double> FREQUENCY = logarithmic(20.0, 20000.0, hz -> hz);
    public static final EncodingRule<Double> LOW_CUT = logarithmic(20.0, 400.0, hz -> hz);

    /**
     * Low cut for mixers that quantize the control coarsely: below 250 Hz the
     * frequency is raised by 1 Hz before encoding so that the stored step
     * lands on or just above the request. Empirical.
     */
    public static final EncodingRule<Double> LOW_CUT_NUDGED =
            logarithmic(20.0, 400.0, hz -> hz < 250.0 ? Math.min(400.0, hz + 1.0) : hz);

    public static final EncodingRule<Boolean> SWITCH = new EncodingRule<>() {
        @Override
        public Object encode(Boolean on) {
            return on ? 1 : 0;
        }

        @Override
        public Boolean decode(Object wire) {
            return number(wire) != 0.0;
        }
    };

    public static final EncodingRule<Boolean> MUTE = new EncodingRule<>() {
        @Override
        public Object encode(Boolean mute) {
            return mute ? 0 : 1;
        }

        @Override
        public Boolean decode(Object wire) {
            return number(wire) == 0.0;
        }
    };

    /**
     * Floats sent unscaled and unclamped (EQ Q, effect parameters with a
     * device-specific meaning).
     */
    public static final EncodingRule<Double> RAW = new EncodingRule<>() {
        @Override
        public Object encode(Double value) {
            return value.floatValue();
        }

        @Override
        public Double decode(Object wire) {
            return number(wire);
        }
    };

    public static final EncodingRule<String> NAME = new EncodingRule<>() {
        @Override
        public Object encode(String value) {
            return value;
        }

        @Override
        public String decode(Object wire) {
            if (wire instanceof String s) {
                return s;
            }
            throw new MixerDecodeException("Expected a string argument, got " + describe(wire));
        }
    };

    // FX send display calibration: dB ≈ 66*log10(level)+8
    private static final double FX_DB_SLOPE = 66.0;
    private static final double FX_DB_OFFSET = 8.0;
    private static final double FX_DB_FLOOR = -100.0;

    private EncodingRules() {}

    /**
     * Integer selector clamped to {@code min..max}.
     */
    public static EncodingRule<Integer> selector(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min > max");
        }
        return new EncodingRule<>() {
            @Override
            public Object encode(Integer value) {
                return Math.max(min, Math.min(max, value));
            }

            @Override
            public Integer decode(Object wire) {
                return (int) Math.round(number(wire));
            }
        };
    }

    /**
     * Convert a dB figure as shown by the vendor's editor into an effect send
     * level. At or below -100 dB the send is off.
     */
    public static double fxSendDbToLevel(double db) {
        if (db <= FX_DB_FLOOR) {
            return 0.0;
        }
        return clamp(Math.pow(10.0, (db - FX_DB_OFFSET) / FX_DB_SLOPE), 0.0, 1.0);
    }

    /**
     * Inverse of {@link #fxSendDbToLevel(double)}; a zero level is
     * {@link Double#NEGATIVE_INFINITY}.
     */
    public static double fxSendLevelToDb(double level) {
        if (level <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        return FX_DB_SLOPE * Math.log10(level) + FX_DB_OFFSET;
    }

    /**
     * wire = (clamp(h) + offset) / span; human = wire * span - offset.
     */
    private static EncodingRule<Double> linear(double min, double max, double offset, double span) {
        return new EncodingRule<>() {
            @Override
            public Object encode(Double value) {
                return (float) ((clamp(value, min, max) + offset) / span);
            }

            @Override
            public Double decode(Object wire) {
                return number(wire) * span - offset;
            }
        };
    }

    /**
     * wire = log10(f / min) / log10(max / min) after clamping and adjusting f.
     */
    private static EncodingRule<Double> logarithmic(double min, double max, DoubleUnaryOperator adjust) {
        Objects.requireNonNull(adjust, "adjust");
        double decades = Math.log10(max / min);
        return new EncodingRule<>() {
            @Override
            public Object encode(Double value) {
                double hz = adjust.applyAsDouble(clamp(value, min, max));
                return (float) (Math.log10(hz / min) / decades);
            }

            @Override
            public Double decode(Object wire) {
                return min * Math.pow(10.0, number(wire) * decades);
            }
        };
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double number(Object wire) {
        if (wire instanceof Number n) {
            return n.doubleValue();
        }
        throw new MixerDecodeException("Expected a numeric argument, got " + describe(wire));
    }

    private static String describe(Object wire) {
        return wire == null ? "null" : wire.getClass().getSimpleName() + " " + wire;
    }
}
