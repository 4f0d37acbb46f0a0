package com.questrail.mixer.protocol.osc;

import com.questrail.mixer.api.AddressProbeResult;
import com.questrail.mixer.api.MixerController;
import com.questrail.mixer.api.MixerFamily;
import com.questrail.mixer.api.MixerOperation;
import com.questrail.mixer.api.MixerQueryTimeoutException;
import com.questrail.mixer.api.MixerStatus;
import com.questrail.mixer.protocol.osc.config.MixerConnectionConfig;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerObservabilitySink;
import com.questrail.mixer.protocol.osc.profile.AddressValueTranslator;
import com.questrail.mixer.protocol.osc.profile.EncodingRules;
import com.questrail.mixer.protocol.osc.profile.FamilyProfile;
import com.questrail.mixer.protocol.osc.runtime.MixerSession;
import com.questrail.mixer.protocol.osc.runtime.OscMixerRuntime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.questrail.mixer.api.MixerOperation.*;

/**
 * OscMixerController
 * =============================================================================
 * Production implementation of {@link MixerController} over OSC/UDP.
 *
 * <p>Every named operation is a thin call into the table-driven
 * {@link #set(MixerOperation, Object, int...)} and
 * {@link #get(MixerOperation, int...)}; the detected family's profile decides
 * the wire address and encoding.</p>
 *
 * <p>Operations other than {@link #status()} and {@link #close()} require a
 * successful {@link #connect()} and throw {@link IllegalStateException}
 * otherwise.</p>
 */
public final class OscMixerController implements MixerController {

    private final OscMixerRuntime runtime;

    public OscMixerController(OscMixerRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public OscMixerController(MixerConnectionConfig config, MixerObservabilitySink sink) {
        this(OscMixerRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(sink)
                .build());
    }

    public MixerFamily connect() {
        return runtime.connect();
    }

    public CompletableFuture<MixerFamily> connectAsync() {
        return runtime.connectAsync();
    }

    public MixerSession session() {
        return runtime.session();
    }

    @Override
    public MixerFamily family() {
        return runtime.session().family();
    }

    // -------------------------------------------------------------------------
    // Generic access
    // -------------------------------------------------------------------------

    @Override
    public <H> void set(MixerOperation<H> operation, H value, int... indices) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(value, "value");
        AddressValueTranslator translator = runtime.established().translator();
        translator.encodeSet(operation, value, indices).ifPresent(runtime.transport()::send);
    }

    @Override
    public <H> CompletableFuture<H> get(MixerOperation<H> operation, int... indices) {
        Objects.requireNonNull(operation, "operation");
        AddressValueTranslator translator = runtime.established().translator();

        Optional<String> address = translator.queryAddress(operation, indices);
        if (address.isEmpty()) {
            return CompletableFuture.completedFuture(operation.placeholder());
        }
        return runtime.correlator()
                .query(address.get(), runtime.timing().queryTimeout())
                .thenApply(wire -> translator.decode(operation, wire));
    }

    // -------------------------------------------------------------------------
    // Channel strip
    // -------------------------------------------------------------------------

    @Override
    public void setFader(int channel, double level) {
        set(CHANNEL_FADER, level, channel);
    }

    @Override
    public CompletableFuture<Double> getFader(int channel) {
        return get(CHANNEL_FADER, channel);
    }

    @Override
    public void muteChannel(int channel, boolean mute) {
        set(CHANNEL_MUTE, mute, channel);
    }

    @Override
    public CompletableFuture<Boolean> getMute(int channel) {
        return get(CHANNEL_MUTE, channel);
    }

    @Override
    public void setPan(int channel, double pan) {
        set(CHANNEL_PAN, pan, channel);
    }

    @Override
    public CompletableFuture<Double> getPan(int channel) {
        return get(CHANNEL_PAN, channel);
    }

    @Override
    public void setChannelName(int channel, String name) {
        set(CHANNEL_NAME, name, channel);
    }

    @Override
    public CompletableFuture<String> getChannelName(int channel) {
        return get(CHANNEL_NAME, channel);
    }

    @Override
    public void setChannelColor(int channel, int color) {
        set(CHANNEL_COLOR, color, channel);
    }

    @Override
    public void setChannelSource(int channel, int source) {
        set(CHANNEL_SOURCE, source, channel);
    }

    @Override
    public CompletableFuture<Integer> getChannelSource(int channel) {
        return get(CHANNEL_SOURCE, channel);
    }

    @Override
    public void setLowCutOn(int channel, boolean on) {
        set(LOW_CUT_ON, on, channel);
    }

    @Override
    public CompletableFuture<Boolean> getLowCutOn(int channel) {
        return get(LOW_CUT_ON, channel);
    }

    @Override
    public void setLowCutFrequency(int channel, double frequencyHz) {
        set(LOW_CUT_FREQUENCY, frequencyHz, channel);
    }

    @Override
    public CompletableFuture<Double> getLowCutFrequency(int channel) {
        return get(LOW_CUT_FREQUENCY, channel);
    }

    // -------------------------------------------------------------------------
    // EQ
    // -------------------------------------------------------------------------

    @Override
    public void setEqOn(int channel, boolean on) {
        set(EQ_ON, on, channel);
    }

    @Override
    public void setEqGain(int channel, int band, double gainDb) {
        set(EQ_GAIN, gainDb, channel, band);
    }

    @Override
    public CompletableFuture<Double> getEqGain(int channel, int band) {
        return get(EQ_GAIN, channel, band);
    }

    @Override
    public void setEqFrequency(int channel, int band, double frequencyHz) {
        set(EQ_FREQUENCY, frequencyHz, channel, band);
    }

    @Override
    public CompletableFuture<Double> getEqFrequency(int channel, int band) {
        return get(EQ_FREQUENCY, channel, band);
    }

    @Override
    public void setEqQ(int channel, int band, double q) {
        set(EQ_Q, q, channel, band);
    }

    @Override
    public void setEqType(int channel, int band, int type) {
        set(EQ_TYPE, type, channel, band);
    }

    // -------------------------------------------------------------------------
    // Dynamics
    // -------------------------------------------------------------------------

    @Override
    public void setGateOn(int channel, boolean on) {
        set(GATE_ON, on, channel);
    }

    @Override
    public void setGateThreshold(int channel, double thresholdDb) {
        set(GATE_THRESHOLD, thresholdDb, channel);
    }

    @Override
    public CompletableFuture<Double> getGateThreshold(int channel) {
        return get(GATE_THRESHOLD, channel);
    }

    @Override
    public void setGateRange(int channel, double range) {
        set(GATE_RANGE, range, channel);
    }

    @Override
    public void setGateAttack(int channel, double attack) {
        set(GATE_ATTACK, attack, channel);
    }

    @Override
    public void setGateHold(int channel, double hold) {
        set(GATE_HOLD, hold, channel);
    }

    @Override
    public void setGateRelease(int channel, double release) {
        set(GATE_RELEASE, release, channel);
    }

    @Override
    public void setCompressorOn(int channel, boolean on) {
        set(COMPRESSOR_ON, on, channel);
    }

    @Override
    public void setCompressor(int channel, double thresholdDb, double ratio) {
        set(COMPRESSOR_THRESHOLD, thresholdDb, channel);
        set(COMPRESSOR_RATIO, ratio, channel);
    }

    @Override
    public void setCompressorAttack(int channel, double attack) {
        set(COMPRESSOR_ATTACK, attack, channel);
    }

    @Override
    public void setCompressorRelease(int channel, double release) {
        set(COMPRESSOR_RELEASE, release, channel);
    }

    @Override
    public void setCompressorKnee(int channel, double knee) {
        set(COMPRESSOR_KNEE, knee, channel);
    }

    @Override
    public void setCompressorGain(int channel, double gain) {
        set(COMPRESSOR_GAIN, gain, channel);
    }

    // -------------------------------------------------------------------------
    // Buses, sends and main mix
    // -------------------------------------------------------------------------

    @Override
    public void setBusFader(int bus, double level) {
        set(BUS_FADER, level, bus);
    }

    @Override
    public CompletableFuture<Double> getBusFader(int bus) {
        return get(BUS_FADER, bus);
    }

    @Override
    public void muteBus(int bus, boolean mute) {
        set(BUS_MUTE, mute, bus);
    }

    @Override
    public CompletableFuture<Boolean> getBusMute(int bus) {
        return get(BUS_MUTE, bus);
    }

    @Override
    public void setBusPan(int bus, double pan) {
        set(BUS_PAN, pan, bus);
    }

    @Override
    public void setBusName(int bus, String name) {
        set(BUS_NAME, name, bus);
    }

    @Override
    public void setSendLevel(int channel, int bus, double level) {
        set(SEND_LEVEL, level, channel, bus);
    }

    @Override
    public CompletableFuture<Double> getSendLevel(int channel, int bus) {
        return get(SEND_LEVEL, channel, bus);
    }

    @Override
    public void setSendPreFader(int channel, int bus, boolean preFader) {
        set(SEND_PRE_FADER, preFader, channel, bus);
    }

    @Override
    public void setFxSendLevel(int channel, int effect, double level) {
        set(FX_SEND_LEVEL, level, channel, effect);
    }

    @Override
    public void setFxSendDb(int channel, int effect, double db) {
        set(FX_SEND_LEVEL, EncodingRules.fxSendDbToLevel(db), channel, effect);
    }

    @Override
    public CompletableFuture<Double> getFxSendLevel(int channel, int effect) {
        return get(FX_SEND_LEVEL, channel, effect);
    }

    @Override
    public void setMainFader(double level) {
        set(MAIN_FADER, level);
    }

    @Override
    public CompletableFuture<Double> getMainFader() {
        return get(MAIN_FADER);
    }

    @Override
    public void muteMain(boolean mute) {
        set(MAIN_MUTE, mute);
    }

    @Override
    public CompletableFuture<Boolean> getMainMute() {
        return get(MAIN_MUTE);
    }

    @Override
    public void setMainPan(double pan) {
        set(MAIN_PAN, pan);
    }

    @Override
    public void setAuxFader(int aux, double level) {
        set(AUX_FADER, level, aux);
    }

    @Override
    public CompletableFuture<Double> getAuxFader(int aux) {
        return get(AUX_FADER, aux);
    }

    @Override
    public void muteAux(int aux, boolean mute) {
        set(AUX_MUTE, mute, aux);
    }

    @Override
    public void setMatrixFader(int matrix, double level) {
        set(MATRIX_FADER, level, matrix);
    }

    @Override
    public CompletableFuture<Double> getMatrixFader(int matrix) {
        return get(MATRIX_FADER, matrix);
    }

    @Override
    public void muteMatrix(int matrix, boolean mute) {
        set(MATRIX_MUTE, mute, matrix);
    }

    // -------------------------------------------------------------------------
    // Effects
    // -------------------------------------------------------------------------

    @Override
    public void setEffectOn(int effect, boolean on) {
        set(EFFECT_ON, on, effect);
    }

    @Override
    public void setEffectMix(int effect, double mix) {
        set(EFFECT_MIX, mix, effect);
    }

    @Override
    public void setEffectParam(int effect, int param, double value) {
        set(EFFECT_PARAM, value, effect, param);
    }

    // -------------------------------------------------------------------------
    // Scenes
    // -------------------------------------------------------------------------

    @Override
    public void recallScene(int scene) {
        runtime.established().scenes().recall(scene);
    }

    @Override
    public void saveScene(int scene, Optional<String> name) {
        runtime.established().scenes().save(scene, name);
    }

    @Override
    public CompletableFuture<String> getSceneName(int scene) {
        return runtime.established().scenes().name(scene);
    }

    // -------------------------------------------------------------------------
    // Status and diagnostics
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<MixerStatus> status() {
        MixerSession session = runtime.session();
        Optional<FamilyProfile> profile = session.profile();
        if (profile.isEmpty() || !session.isConnected()) {
            return CompletableFuture.completedFuture(new MixerStatus(
                    false, session.host(), session.port(), session.family(),
                    0, 0, 0, 0, Optional.empty(), Optional.of("Not connected")));
        }

        FamilyProfile p = profile.get();
        return runtime.correlator()
                .query(p.identificationAddress(), runtime.timing().queryTimeout())
                .handle((info, failure) -> failure == null
                        ? statusOf(session, p, true, Optional.of(String.valueOf(info)), Optional.empty())
                        : statusOf(session, p, false, Optional.empty(), Optional.of(messageOf(failure))));
    }

    @Override
    public CompletableFuture<List<AddressProbeResult>> verifyAddresses(List<String> addresses) {
        Objects.requireNonNull(addresses, "addresses");
        runtime.established();

        List<AddressProbeResult> results = new ArrayList<>(addresses.size());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String address : addresses) {
            chain = chain.thenCompose(ignored -> probe(address)).thenAccept(results::add);
        }
        return chain.thenApply(ignored -> List.copyOf(results));
    }

    @Override
    public void sendRaw(String address, Object... arguments) {
        runtime.established();
        runtime.transport().send(OscMessage.of(address, arguments));
    }

    @Override
    public void close() {
        runtime.close();
    }

    private CompletableFuture<AddressProbeResult> probe(String address) {
        CompletableFuture<Object> reply;
        try {
            reply = runtime.correlator().query(address, runtime.timing().queryTimeout());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    new AddressProbeResult(address, AddressProbeResult.Outcome.ERROR, e.getMessage()));
        }

        return reply.handle((value, failure) -> {
            if (failure == null) {
                return new AddressProbeResult(address, AddressProbeResult.Outcome.RESPONDED, String.valueOf(value));
            }
            Throwable cause = unwrap(failure);
            if (cause instanceof MixerQueryTimeoutException) {
                return new AddressProbeResult(address, AddressProbeResult.Outcome.TIMEOUT, "");
            }
            return new AddressProbeResult(address, AddressProbeResult.Outcome.ERROR, messageOf(cause));
        });
    }

    private static MixerStatus statusOf(MixerSession session, FamilyProfile p, boolean connected,
                                        Optional<String> info, Optional<String> error) {
        return new MixerStatus(
                connected,
                session.host(),
                session.port(),
                p.family(),
                p.channels(),
                p.buses(),
                p.effects(),
                p.scenes().scene().count(),
                info,
                error);
    }

    private static String messageOf(Throwable failure) {
        Throwable cause = unwrap(failure);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
