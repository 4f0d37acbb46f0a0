package com.questrail.mixer.protocol.osc.scene;

import com.questrail.mixer.api.MixerDecodeException;
import com.questrail.mixer.protocol.osc.internal.correlate.RequestCorrelator;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.profile.EncodingRules;
import com.questrail.mixer.protocol.osc.profile.SceneAddressing;
import com.questrail.mixer.protocol.osc.transport.OscSender;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * SceneSubsystem
 * =============================================================================
 * Recall, save and name lookup of scenes (snapshots) stored on the mixer.
 *
 * <p>Scene state lives on the device. This class only shapes the request
 * sequences, which differ per family:</p>
 *
 * <pre>
 *   save, per-scene names:   store [idx]; /-snap/NNN/name [name]
 *   save, active-only names: load [idx]; /-snap/name [name]; save [idx]
 * </pre>
 *
 * <p>On active-only families a stored scene's name cannot be read without
 * loading it, so {@link #name(int)} reads the active index first and answers
 * {@code ""} for any other scene.</p>
 *
 * <p>Scene numbers are human (1-based). Out-of-range numbers are rejected
 * with {@link IllegalArgumentException} before anything is sent.</p>
 */
public final class SceneSubsystem {

    private final OscSender sender;
    private final RequestCorrelator correlator;
    private final SceneAddressing scenes;
    private final Duration queryTimeout;

    public SceneSubsystem(OscSender sender, RequestCorrelator correlator, SceneAddressing scenes, Duration queryTimeout) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.scenes = Objects.requireNonNull(scenes, "scenes");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout");
    }

    public int count() {
        return scenes.scene().count();
    }

    public void recall(int scene) {
        int wire = scenes.scene().toWire(scene);
        sender.send(OscMessage.of(scenes.loadAddress(), wire));
    }

    /**
     * Store the current mixer state as {@code scene}, optionally naming it.
     * A blank name leaves the stored name unchanged.
     */
    public void save(int scene, Optional<String> name) {
        Objects.requireNonNull(name, "name");
        int wire = scenes.scene().toWire(scene);
        Optional<String> label = name.filter(n -> !n.isEmpty());

        if (scenes.loadBeforeSave()) {
            sender.send(OscMessage.of(scenes.loadAddress(), wire));
            label.ifPresent(n -> sender.send(OscMessage.of(scenes.nameAddressFor(scene), n)));
            sender.send(OscMessage.of(scenes.saveAddress(), wire));
        } else {
            sender.send(OscMessage.of(scenes.saveAddress(), wire));
            label.ifPresent(n -> sender.send(OscMessage.of(scenes.nameAddressFor(scene), n)));
        }
    }

    /**
     * Name of {@code scene}. Fails with
     * {@link com.questrail.mixer.api.MixerQueryTimeoutException} when the
     * mixer does not answer.
     */
    public CompletableFuture<String> name(int scene) {
        int wire = scenes.scene().toWire(scene);
        String nameAddress = scenes.nameAddressFor(scene);

        if (scenes.perSceneNames()) {
            return correlator.query(nameAddress, queryTimeout).thenApply(EncodingRules.NAME::decode);
        }

        String indexAddress = scenes.activeIndexAddress().orElseThrow();
        return correlator.query(indexAddress, queryTimeout).thenCompose(active -> {
            if (activeIndex(active) != wire) {
                return CompletableFuture.completedFuture("");
            }
            return correlator.query(nameAddress, queryTimeout).thenApply(EncodingRules.NAME::decode);
        });
    }

    private static int activeIndex(Object wire) {
        if (wire instanceof Number n) {
            return n.intValue();
        }
        if (wire instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new MixerDecodeException("Active scene index is not a number: " + s);
            }
        }
        throw new MixerDecodeException("Active scene index has unexpected type: " + wire);
    }
}
