package com.questrail.mixer.api;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * MixerController
 * -----------------------------------------------------------------------------
 * {@code MixerController} is the semantic façade for remote control of one
 * digital mixer.
 *
 * <h2>Indices and units</h2>
 * Every index is a 1-based human index (channel 1, bus 1, scene 1), whatever
 * index base and zero padding the connected family uses on the wire. Values
 * are in human units: fader levels in the console's 0.0..1.0 scale
 * (0.75 = 0 dB), pan in -1.0..1.0, gains and thresholds in dB, frequencies in
 * Hz.
 *
 * <h2>Mutations</h2>
 * Setters are fire-and-forget: they validate, encode and hand a single
 * datagram (or a fixed sequence for scene save) to the transport, then return.
 * Values outside their documented range are clamped. Indices outside the
 * family's range are rejected with {@link IllegalArgumentException} before
 * anything is sent.
 *
 * <h2>Queries</h2>
 * Getters return a {@link CompletableFuture} completed with the decoded reply,
 * or failed with {@link MixerQueryTimeoutException}. There is no retry; the
 * caller decides whether to ask again.
 *
 * <h2>Unsupported operations</h2>
 * Some controls exist on only one family (aux inputs and matrix outputs on
 * X32, effect sends on X-Air). On the other family a setter is a silent no-op
 * and a getter completes with {@link MixerOperation#placeholder()}. This is
 * never an error.
 *
 * <h2>Threading</h2>
 * Implementations are safe for use from multiple threads. Queries to distinct
 * addresses may be outstanding at the same time.
 */
public interface MixerController extends AutoCloseable
{
    /**
     * Family detected for this session, or {@link MixerFamily#UNKNOWN} before
     * the session is established.
     */
    MixerFamily family();

    // -------------------------------------------------------------------------
    // Generic table-driven access
    // -------------------------------------------------------------------------

    /**
     * Set any logical control.
     *
     * @param indices 1-based indices in the order the operation expects
     *                (channel, then band/bus/effect/parameter)
     */
    <H> void set(MixerOperation<H> operation, H value, int... indices);

    /**
     * Query any logical control.
     */
    <H> CompletableFuture<H> get(MixerOperation<H> operation, int... indices);

    // -------------------------------------------------------------------------
    // Channel strip
    // -------------------------------------------------------------------------

    void setFader(int channel, double level);

    CompletableFuture<Double> getFader(int channel);

    void muteChannel(int channel, boolean mute);

    CompletableFuture<Boolean> getMute(int channel);

    void setPan(int channel, double pan);

    CompletableFuture<Double> getPan(int channel);

    void setChannelName(int channel, String name);

    CompletableFuture<String> getChannelName(int channel);

    void setChannelColor(int channel, int color);

    void setChannelSource(int channel, int source);

    CompletableFuture<Integer> getChannelSource(int channel);

    void setLowCutOn(int channel, boolean on);

    CompletableFuture<Boolean> getLowCutOn(int channel);

    /**
     * Set the preamp high-pass ("low cut") frequency, clamped to 20..400 Hz.
     * The device quantizes the value, so a subsequent read may differ by a
     * few Hz.
     */
    void setLowCutFrequency(int channel, double frequencyHz);

    CompletableFuture<Double> getLowCutFrequency(int channel);

    // -------------------------------------------------------------------------
    // EQ
    // -------------------------------------------------------------------------

    void setEqOn(int channel, boolean on);

    void setEqGain(int channel, int band, double gainDb);

    CompletableFuture<Double> getEqGain(int channel, int band);

    void setEqFrequency(int channel, int band, double frequencyHz);

    CompletableFuture<Double> getEqFrequency(int channel, int band);

    void setEqQ(int channel, int band, double q);

    void setEqType(int channel, int band, int type);

    // -------------------------------------------------------------------------
    // Dynamics
    // -------------------------------------------------------------------------

    void setGateOn(int channel, boolean on);

    void setGateThreshold(int channel, double thresholdDb);

    CompletableFuture<Double> getGateThreshold(int channel);

    void setGateRange(int channel, double range);

    void setGateAttack(int channel, double attack);

    void setGateHold(int channel, double hold);

    void setGateRelease(int channel, double release);

    void setCompressorOn(int channel, boolean on);

    /**
     * Set compressor threshold (-60..0 dB) and ratio (1..20) as two datagrams.
     */
    void setCompressor(int channel, double thresholdDb, double ratio);

    void setCompressorAttack(int channel, double attack);

    void setCompressorRelease(int channel, double release);

    void setCompressorKnee(int channel, double knee);

    void setCompressorGain(int channel, double gain);

    // -------------------------------------------------------------------------
    // Buses, sends and main mix
    // -------------------------------------------------------------------------

    void setBusFader(int bus, double level);

    CompletableFuture<Double> getBusFader(int bus);

    void muteBus(int bus, boolean mute);

    CompletableFuture<Boolean> getBusMute(int bus);

    void setBusPan(int bus, double pan);

    void setBusName(int bus, String name);

    void setSendLevel(int channel, int bus, double level);

    CompletableFuture<Double> getSendLevel(int channel, int bus);

    void setSendPreFader(int channel, int bus, boolean preFader);

    void setFxSendLevel(int channel, int effect, double level);

    /**
     * Set an effect send from a dB figure as displayed by the vendor's editor,
     * using the calibrated dB-to-level curve.
     */
    void setFxSendDb(int channel, int effect, double db);

    CompletableFuture<Double> getFxSendLevel(int channel, int effect);

    void setMainFader(double level);

    CompletableFuture<Double> getMainFader();

    void muteMain(boolean mute);

    CompletableFuture<Boolean> getMainMute();

    void setMainPan(double pan);

    void setAuxFader(int aux, double level);

    CompletableFuture<Double> getAuxFader(int aux);

    void muteAux(int aux, boolean mute);

    void setMatrixFader(int matrix, double level);

    CompletableFuture<Double> getMatrixFader(int matrix);

    void muteMatrix(int matrix, boolean mute);

    // -------------------------------------------------------------------------
    // Effects
    // -------------------------------------------------------------------------

    void setEffectOn(int effect, boolean on);

    void setEffectMix(int effect, double mix);

    void setEffectParam(int effect, int param, double value);

    // -------------------------------------------------------------------------
    // Scenes
    // -------------------------------------------------------------------------

    void recallScene(int scene);

    void saveScene(int scene, Optional<String> name);

    /**
     * Name of a stored scene. On families that only expose the active scene's
     * name, completes with an empty string when {@code scene} is not the
     * active one.
     */
    CompletableFuture<String> getSceneName(int scene);

    // -------------------------------------------------------------------------
    // Status and diagnostics
    // -------------------------------------------------------------------------

    /**
     * Query the identification address and report session health. Never
     * completes exceptionally; failures are reported in
     * {@link MixerStatus#error()}.
     */
    CompletableFuture<MixerStatus> status();

    /**
     * Query each address in turn and report which ones the device answers.
     */
    CompletableFuture<List<AddressProbeResult>> verifyAddresses(List<String> addresses);

    /**
     * Send an arbitrary OSC message. Intended for controls this interface does
     * not model.
     */
    void sendRaw(String address, Object... arguments);

    /**
     * Stop the keepalive and release the UDP endpoint.
     */
    @Override
    void close();
}
