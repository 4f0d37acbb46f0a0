package com.questrail.mixer.protocol.osc.profile;

import com.questrail.mixer.api.MixerFamily;
import com.questrail.mixer.api.MixerOperation;
import com.questrail.mixer.protocol.osc.model.OscMessage;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.questrail.mixer.api.MixerOperation.*;
import static org.junit.jupiter.api.Assertions.*;

class AddressValueTranslatorTest {

    private final AddressValueTranslator x32 = new AddressValueTranslator(FamilyProfiles.X32);
    private final AddressValueTranslator xAir = new AddressValueTranslator(FamilyProfiles.X_AIR);

    private static OscMessage set(AddressValueTranslator t, MixerOperation<Double> op,
                                  double value, int... indices) {
        return t.encodeSet(op, value, indices).orElseThrow();
    }

    @Test
    void channelAddressesAreZeroPaddedOnBothFamilies() {
        assertEquals(OscMessage.of("/ch/01/mix/fader", 0.75f), set(x32, CHANNEL_FADER, 0.75, 1));
        assertEquals(OscMessage.of("/ch/16/mix/fader", 0.75f), set(xAir, CHANNEL_FADER, 0.75, 16));
        assertEquals(Optional.of("/ch/32/config/name"), x32.queryAddress(CHANNEL_NAME, 32));
    }

    @Test
    void busPaddingDiffersPerFamily() {
        assertEquals("/bus/03/mix/fader", set(x32, BUS_FADER, 0.5, 3).address());
        assertEquals("/bus/3/mix/fader", set(xAir, BUS_FADER, 0.5, 3).address());
        assertEquals(Optional.of("/bus/6/config/name"), xAir.queryAddress(BUS_NAME, 6));
    }

    @Test
    void mainMixAndEffectsUseFamilySpecificAddresses() {
        assertEquals("/main/st/mix/fader", set(x32, MAIN_FADER, 0.7).address());
        assertEquals("/lr/mix/fader", set(xAir, MAIN_FADER, 0.7).address());

        assertEquals(OscMessage.of("/fx/2/on", 1), x32.encodeSet(EFFECT_ON, true, 2).orElseThrow());
        assertEquals(OscMessage.of("/fx/2/insert", 1), xAir.encodeSet(EFFECT_ON, true, 2).orElseThrow());
        assertEquals("/fx/1/par/05", set(xAir, EFFECT_PARAM, 0.3, 1, 5).address());
    }

    @Test
    void muteIsSentAsTheInvertedOnControl() {
        assertEquals(OscMessage.of("/ch/04/mix/on", 0), x32.encodeSet(CHANNEL_MUTE, true, 4).orElseThrow());
        assertEquals(OscMessage.of("/lr/mix/on", 1), xAir.encodeSet(MAIN_MUTE, false).orElseThrow());
        assertTrue(xAir.decode(CHANNEL_MUTE, 0));
    }

    @Test
    void eqAndDynamicsAddresses() {
        assertEquals(OscMessage.of("/ch/02/eq/3/g", 0.5f), set(x32, EQ_GAIN, 0.0, 2, 3));
        assertEquals("/ch/02/eq/3/f", set(x32, EQ_FREQUENCY, 1000.0, 2, 3).address());
        assertEquals(OscMessage.of("/ch/05/gate/thr", 0.5f), set(xAir, GATE_THRESHOLD, -40.0, 5));
        assertEquals("/ch/05/dyn/mgain", set(x32, COMPRESSOR_GAIN, 0.2, 5).address());
        assertEquals("/ch/05/dyn/gain", set(xAir, COMPRESSOR_GAIN, 0.2, 5).address());
    }

    @Test
    void channelSourceAddressAndClampPerFamily() {
        assertEquals(OscMessage.of("/ch/01/config/insrc", 15), xAir.encodeSet(CHANNEL_SOURCE, 20, 1).orElseThrow());
        assertEquals(OscMessage.of("/ch/01/config/source", 20), x32.encodeSet(CHANNEL_SOURCE, 20, 1).orElseThrow());
        assertEquals(OscMessage.of("/ch/01/config/source", 64), x32.encodeSet(CHANNEL_SOURCE, 99, 1).orElseThrow());
    }

    @Test
    void lowCutIsNudgedOnlyOnRackMixers() {
        float plain = (Float) set(x32, LOW_CUT_FREQUENCY, 100.0, 1).arguments().get(0);
        float nudged = (Float) set(xAir, LOW_CUT_FREQUENCY, 100.0, 1).arguments().get(0);

        assertEquals("/ch/01/preamp/hpf", set(xAir, LOW_CUT_FREQUENCY, 100.0, 1).address());
        assertTrue(nudged > plain);
    }

    @Test
    void fxSendsUseMixSlotsSevenToTenOnRackMixers() {
        assertEquals("/ch/05/mix/07/level", set(xAir, FX_SEND_LEVEL, 0.5, 5, 1).address());
        assertEquals("/ch/05/mix/10/level", set(xAir, FX_SEND_LEVEL, 0.5, 5, 4).address());
        assertEquals("/ch/05/mix/02/preamp", xAir.encodeSet(SEND_PRE_FADER, true, 5, 2).orElseThrow().address());
        assertEquals("/ch/05/mix/12/level", set(x32, SEND_LEVEL, 0.5, 5, 12).address());
    }

    @Test
    void unsupportedOperationsYieldNothingWithoutCheckingIndices() {
        assertEquals(Optional.empty(), xAir.encodeSet(AUX_FADER, 0.5, 1));
        assertEquals(Optional.empty(), xAir.encodeSet(MATRIX_MUTE, true, 99));
        assertEquals(Optional.empty(), xAir.queryAddress(MATRIX_FADER, 1));
        assertEquals(Optional.empty(), x32.encodeSet(FX_SEND_LEVEL, 0.5, 1, 1));
        assertEquals(Optional.empty(), x32.encodeSet(EFFECT_MIX, 0.5, 1));
        assertEquals(Optional.empty(), x32.queryAddress(SEND_PRE_FADER, 1, 1));

        assertEquals(Optional.of("/auxin/08/mix/fader"), x32.queryAddress(AUX_FADER, 8));
        assertEquals(Optional.of("/mtx/06/mix/on"), x32.queryAddress(MATRIX_MUTE, 6));
    }

    @Test
    void outOfRangeIndicesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> xAir.encodeSet(CHANNEL_FADER, 0.5, 17));
        assertThrows(IllegalArgumentException.class, () -> x32.encodeSet(CHANNEL_FADER, 0.5, 33));
        assertThrows(IllegalArgumentException.class, () -> x32.encodeSet(CHANNEL_FADER, 0.5, 0));
        assertThrows(IllegalArgumentException.class, () -> xAir.encodeSet(BUS_FADER, 0.5, 7));
        assertThrows(IllegalArgumentException.class, () -> xAir.encodeSet(EFFECT_ON, true, 5));
        assertThrows(IllegalArgumentException.class, () -> x32.encodeSet(EQ_GAIN, 0.0, 1, 5));
        assertThrows(IllegalArgumentException.class, () -> xAir.queryAddress(FX_SEND_LEVEL, 1, 5));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> xAir.queryAddress(CHANNEL_FADER, 17));
        assertEquals("channel 17 out of range 1..16", e.getMessage());
    }

    @Test
    void wrongNumberOfIndicesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> x32.queryAddress(CHANNEL_FADER));
        assertThrows(IllegalArgumentException.class, () -> x32.queryAddress(MAIN_FADER, 1));
    }

    @Test
    void profilesDescribeTheirFamilies() {
        assertEquals(List.of(MixerFamily.X_AIR, MixerFamily.X32),
                FamilyProfiles.detectionOrder().stream().map(FamilyProfile::family).toList());
        assertEquals("/info", FamilyProfiles.X32.identificationAddress());
        assertEquals("/xinfo", FamilyProfiles.X_AIR.identificationAddress());
        assertEquals("/xremote", FamilyProfiles.X_AIR.keepaliveAddress());
        assertEquals(100, FamilyProfiles.X32.scenes().scene().count());
        assertEquals(64, FamilyProfiles.X_AIR.scenes().scene().count());
        assertEquals(Optional.of(FamilyProfiles.X32), FamilyProfiles.forFamily(MixerFamily.X32));
        assertEquals(Optional.empty(), FamilyProfiles.forFamily(MixerFamily.UNKNOWN));
    }

    @Test
    void paddedIndicesUseAsciiDigitsWhateverTheDefaultLocale() {
        Locale saved = Locale.getDefault(Locale.Category.FORMAT);
        Locale.setDefault(Locale.Category.FORMAT, Locale.forLanguageTag("ar-SA-u-nu-arab"));
        try {
            assertEquals(Optional.of("/ch/01/mix/fader"), xAir.queryAddress(CHANNEL_FADER, 1));
            assertEquals(Optional.of("/bus/12/mix/fader"), x32.queryAddress(BUS_FADER, 12));
            assertEquals("/fx/1/par/05", set(xAir, EFFECT_PARAM, 0.3, 1, 5).address());
            assertEquals("/-snap/042/name", FamilyProfiles.X32.scenes().nameAddressFor(43));
        } finally {
            Locale.setDefault(Locale.Category.FORMAT, saved);
        }
    }
}
