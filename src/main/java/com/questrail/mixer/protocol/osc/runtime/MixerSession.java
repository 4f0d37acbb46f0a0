package com.questrail.mixer.protocol.osc.runtime;

import com.questrail.mixer.api.MixerFamily;
import com.questrail.mixer.protocol.osc.profile.FamilyProfile;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one connection to one mixer.
 *
 * <p>The family profile is written exactly once, by family detection, and is
 * read-only afterwards. Sessions are plain objects; any number may coexist.</p>
 */
public final class MixerSession {

    private final String host;
    private final int port;
    private final AtomicReference<FamilyProfile> profile = new AtomicReference<>();
    private volatile boolean connected;

    public MixerSession(String host, int port) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public Optional<FamilyProfile> profile() {
        return Optional.ofNullable(profile.get());
    }

    public MixerFamily family() {
        FamilyProfile p = profile.get();
        return p == null ? MixerFamily.UNKNOWN : p.family();
    }

    /**
     * True between successful detection and {@link #markClosed()}.
     */
    public boolean isConnected() {
        return connected;
    }

    /**
     * Record the detected family.
     *
     * @throws IllegalStateException if a family was already recorded
     */
    void establish(FamilyProfile detected) {
        Objects.requireNonNull(detected, "detected");
        if (!profile.compareAndSet(null, detected)) {
            throw new IllegalStateException("Session " + host + ":" + port
                    + " already established as " + profile.get().family().label());
        }
        connected = true;
    }

    void markClosed() {
        connected = false;
    }

    @Override
    public String toString() {
        return "MixerSession[" + host + ":" + port + ", " + family().label() + "]";
    }
}
