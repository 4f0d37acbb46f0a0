package com.questrail.mixer.protocol.osc.profile;

import com.questrail.mixer.api.MixerFamily;

import java.util.List;
import java.util.Optional;

import static com.questrail.mixer.api.MixerOperation.*;

/**
 * The two supported mixer families.
 *
 * <ul>
 *   <li>{@link #X32}: full-size consoles. 32 channels, 16 buses, aux inputs,
 *       matrix outputs, 8 effects, 100 zero-based scenes.</li>
 *   <li>{@link #X_AIR}: rack mixers. 16 channels, 6 buses, 4 effects with
 *       dedicated send slots, 64 one-based scenes; only the active scene's
 *       name is readable.</li>
 * </ul>
 *
 * <p>Detection probes {@link #detectionOrder()} in order: X-Air
 * ({@code /xinfo}) first, then X32 ({@code /info}).</p>
 */
public final class FamilyProfiles {

    private static final int EQ_BANDS = 4;
    private static final int EFFECT_PARAMS = 64;

    // X-Air effect sends occupy mix slots 7..10
    private static final int FX_SEND_SLOT_SHIFT = 6;

    public static final FamilyProfile X32 = x32();
    public static final FamilyProfile X_AIR = xAir();

    private static final List<FamilyProfile> DETECTION_ORDER = List.of(X_AIR, X32);

    private FamilyProfiles() {}

    public static List<FamilyProfile> detectionOrder() {
        return DETECTION_ORDER;
    }

    public static Optional<FamilyProfile> forFamily(MixerFamily family) {
        return DETECTION_ORDER.stream().filter(p -> p.family() == family).findFirst();
    }

    private static FamilyProfile x32() {
        IndexRule channel = IndexRule.padded("channel", 32, 2);
        IndexRule bus = IndexRule.padded("bus", 16, 2);
        IndexRule effect = IndexRule.plain("effect", 8);
        IndexRule aux = IndexRule.padded("aux", 8, 2);
        IndexRule matrix = IndexRule.padded("matrix", 6, 2);

        FamilyProfile.Builder b = FamilyProfile.builder(MixerFamily.X32)
                .identification("/info")
                .keepalive("/xremote")
                .capacities(32, 16, 8)
                .scenes(new SceneAddressing(
                        new IndexRule("scene", 1, 100, -1, 3),
                        "/-snap/load",
                        "/-snap/store",
                        false,
                        "/-snap/{}/name",
                        Optional.empty()));

        channelStrip(b, channel);
        buses(b, bus);
        effects(b, effect);

        return b
                .bind(CHANNEL_SOURCE, "/ch/{}/config/source", EncodingRules.selector(0, 64), channel)
                .bind(LOW_CUT_FREQUENCY, "/ch/{}/preamp/hpf", EncodingRules.LOW_CUT, channel)
                .bind(COMPRESSOR_GAIN, "/ch/{}/dyn/mgain", EncodingRules.UNIT, channel)
                .bind(SEND_LEVEL, "/ch/{}/mix/{}/level", EncodingRules.LEVEL, channel, bus)
                .bind(MAIN_FADER, "/main/st/mix/fader", EncodingRules.LEVEL)
                .bind(MAIN_MUTE, "/main/st/mix/on", EncodingRules.MUTE)
                .bind(MAIN_PAN, "/main/st/mix/pan", EncodingRules.PAN)
                .bind(AUX_FADER, "/auxin/{}/mix/fader", EncodingRules.LEVEL, aux)
                .bind(AUX_MUTE, "/auxin/{}/mix/on", EncodingRules.MUTE, aux)
                .bind(MATRIX_FADER, "/mtx/{}/mix/fader", EncodingRules.LEVEL, matrix)
                .bind(MATRIX_MUTE, "/mtx/{}/mix/on", EncodingRules.MUTE, matrix)
                .bind(EFFECT_ON, "/fx/{}/on", EncodingRules.SWITCH, effect)
                .build();
    }

    private static FamilyProfile xAir() {
        IndexRule channel = IndexRule.padded("channel", 16, 2);
        IndexRule bus = IndexRule.plain("bus", 6);
        IndexRule sendBus = IndexRule.padded("bus", 6, 2);
        IndexRule effect = IndexRule.plain("effect", 4);
        IndexRule fxSlot = new IndexRule("effect", 1, 4, FX_SEND_SLOT_SHIFT, 2);

        FamilyProfile.Builder b = FamilyProfile.builder(MixerFamily.X_AIR)
                .identification("/xinfo")
                .keepalive("/xremote")
                .capacities(16, 6, 4)
                .scenes(new SceneAddressing(
                        new IndexRule("scene", 1, 64, 0, 0),
                        "/-snap/load",
                        "/-snap/save",
                        true,
                        "/-snap/name",
                        Optional.of("/-snap/index")));

        channelStrip(b, channel);
        buses(b, bus);
        effects(b, effect);

        return b
                .bind(CHANNEL_SOURCE, "/ch/{}/config/insrc", EncodingRules.selector(0, 15), channel)
                .bind(LOW_CUT_FREQUENCY, "/ch/{}/preamp/hpf", EncodingRules.LOW_CUT_NUDGED, channel)
                .bind(COMPRESSOR_GAIN, "/ch/{}/dyn/gain", EncodingRules.UNIT, channel)
                .bind(SEND_LEVEL, "/ch/{}/mix/{}/level", EncodingRules.LEVEL, channel, sendBus)
                .bind(SEND_PRE_FADER, "/ch/{}/mix/{}/preamp", EncodingRules.SWITCH, channel, sendBus)
                .bind(FX_SEND_LEVEL, "/ch/{}/mix/{}/level", EncodingRules.LEVEL, channel, fxSlot)
                .bind(MAIN_FADER, "/lr/mix/fader", EncodingRules.LEVEL)
                .bind(MAIN_MUTE, "/lr/mix/on", EncodingRules.MUTE)
                .bind(MAIN_PAN, "/lr/mix/pan", EncodingRules.PAN)
                .bind(EFFECT_ON, "/fx/{}/insert", EncodingRules.SWITCH, effect)
                .bind(EFFECT_MIX, "/fx/{}/mix", EncodingRules.UNIT, effect)
                .build();
    }

    /**
     * Channel strip controls with identical addressing on both families.
     */
    private static void channelStrip(FamilyProfile.Builder b, IndexRule channel) {
        IndexRule band = IndexRule.plain("band", EQ_BANDS);

        b.bind(CHANNEL_FADER, "/ch/{}/mix/fader", EncodingRules.LEVEL, channel)
                .bind(CHANNEL_MUTE, "/ch/{}/mix/on", EncodingRules.MUTE, channel)
                .bind(CHANNEL_PAN, "/ch/{}/mix/pan", EncodingRules.PAN, channel)
                .bind(CHANNEL_NAME, "/ch/{}/config/name", EncodingRules.NAME, channel)
                .bind(CHANNEL_COLOR, "/ch/{}/config/color", EncodingRules.selector(0, 15), channel)
                .bind(LOW_CUT_ON, "/ch/{}/preamp/hpon", EncodingRules.SWITCH, channel)

                .bind(EQ_ON, "/ch/{}/eq/on", EncodingRules.SWITCH, channel)
                .bind(EQ_GAIN, "/ch/{}/eq/{}/g", EncodingRules.EQ_GAIN, channel, band)
                .bind(EQ_FREQUENCY, "/ch/{}/eq/{}/f", EncodingRules.FREQUENCY, channel, band)
                .bind(EQ_Q, "/ch/{}/eq/{}/q", EncodingRules.RAW, channel, band)
                .bind(EQ_TYPE, "/ch/{}/eq/{}/type", EncodingRules.selector(0, 5), channel, band)

                .bind(GATE_ON, "/ch/{}/gate/on", EncodingRules.SWITCH, channel)
                .bind(GATE_THRESHOLD, "/ch/{}/gate/thr", EncodingRules.GATE_THRESHOLD, channel)
                .bind(GATE_RANGE, "/ch/{}/gate/range", EncodingRules.UNIT, channel)
                .bind(GATE_ATTACK, "/ch/{}/gate/attack", EncodingRules.UNIT, channel)
                .bind(GATE_HOLD, "/ch/{}/gate/hold", EncodingRules.UNIT, channel)
                .bind(GATE_RELEASE, "/ch/{}/gate/release", EncodingRules.UNIT, channel)

                .bind(COMPRESSOR_ON, "/ch/{}/dyn/on", EncodingRules.SWITCH, channel)
                .bind(COMPRESSOR_THRESHOLD, "/ch/{}/dyn/thr", EncodingRules.COMPRESSOR_THRESHOLD, channel)
                .bind(COMPRESSOR_RATIO, "/ch/{}/dyn/ratio", EncodingRules.COMPRESSOR_RATIO, channel)
                .bind(COMPRESSOR_ATTACK, "/ch/{}/dyn/attack", EncodingRules.UNIT, channel)
                .bind(COMPRESSOR_RELEASE, "/ch/{}/dyn/release", EncodingRules.UNIT, channel)
                .bind(COMPRESSOR_KNEE, "/ch/{}/dyn/knee", EncodingRules.UNIT, channel);
    }

    private static void buses(FamilyProfile.Builder b, IndexRule bus) {
        b.bind(BUS_FADER, "/bus/{}/mix/fader", EncodingRules.LEVEL, bus)
                .bind(BUS_MUTE, "/bus/{}/mix/on", EncodingRules.MUTE, bus)
                .bind(BUS_PAN, "/bus/{}/mix/pan", EncodingRules.PAN, bus)
                .bind(BUS_NAME, "/bus/{}/config/name", EncodingRules.NAME, bus);
    }

    private static void effects(FamilyProfile.Builder b, IndexRule effect) {
        IndexRule param = IndexRule.padded("param", EFFECT_PARAMS, 2);
        b.bind(EFFECT_PARAM, "/fx/{}/par/{}", EncodingRules.UNIT, effect, param);
    }
}
