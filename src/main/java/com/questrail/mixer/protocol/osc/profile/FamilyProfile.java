package com.questrail.mixer.protocol.osc.profile;

import com.questrail.mixer.api.MixerFamily;
import com.questrail.mixer.api.MixerOperation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FamilyProfile
 * -----------------------------------------------------------------------------
 * Immutable table describing one mixer family: identification and keepalive
 * addresses, capacities, scene addressing, and the binding of every supported
 * {@link MixerOperation} to a wire address and encoding.
 *
 * <p>An operation without a binding is unsupported on this family.</p>
 */
public final class FamilyProfile {

    private final MixerFamily family;
    private final String identificationAddress;
    private final String keepaliveAddress;
    private final int channels;
    private final int buses;
    private final int effects;
    private final SceneAddressing scenes;
    private final Map<MixerOperation<?>, OperationBinding<?>> bindings;

    private FamilyProfile(Builder b) {
        this.family = Objects.requireNonNull(b.family, "family");
        this.identificationAddress = Objects.requireNonNull(b.identificationAddress, "identificationAddress");
        this.keepaliveAddress = Objects.requireNonNull(b.keepaliveAddress, "keepaliveAddress");
        this.scenes = Objects.requireNonNull(b.scenes, "scenes");
        this.channels = b.channels;
        this.buses = b.buses;
        this.effects = b.effects;
        this.bindings = Map.copyOf(b.bindings);
    }

    public MixerFamily family() {
        return family;
    }

    public String identificationAddress() {
        return identificationAddress;
    }

    public String keepaliveAddress() {
        return keepaliveAddress;
    }

    public int channels() {
        return channels;
    }

    public int buses() {
        return buses;
    }

    public int effects() {
        return effects;
    }

    public SceneAddressing scenes() {
        return scenes;
    }

    @SuppressWarnings("unchecked")
    public <H> Optional<OperationBinding<H>> binding(MixerOperation<H> operation) {
        return Optional.ofNullable((OperationBinding<H>) bindings.get(operation));
    }

    @Override
    public String toString() {
        return "FamilyProfile[" + family.label() + "]";
    }

    public static Builder builder(MixerFamily family) {
        return new Builder(family);
    }

    public static final class Builder {
        private final MixerFamily family;
        private String identificationAddress;
        private String keepaliveAddress;
        private int channels;
        private int buses;
        private int effects;
        private SceneAddressing scenes;
        private final Map<MixerOperation<?>, OperationBinding<?>> bindings = new HashMap<>();

        private Builder(MixerFamily family) {
            this.family = family;
        }

        public Builder identification(String address) {
            this.identificationAddress = address;
            return this;
        }

        public Builder keepalive(String address) {
            this.keepaliveAddress = address;
            return this;
        }

        public Builder capacities(int channels, int buses, int effects) {
            this.channels = channels;
            this.buses = buses;
            this.effects = effects;
            return this;
        }

        public Builder scenes(SceneAddressing scenes) {
            this.scenes = scenes;
            return this;
        }

        public <H> Builder bind(MixerOperation<H> operation, String template, EncodingRule<H> rule, IndexRule... indices) {
            Objects.requireNonNull(operation, "operation");
            if (bindings.putIfAbsent(operation, new OperationBinding<>(template, List.of(indices), rule)) != null) {
                throw new IllegalStateException(operation + " bound twice for " + family);
            }
            return this;
        }

        public FamilyProfile build() {
            return new FamilyProfile(this);
        }
    }
}
