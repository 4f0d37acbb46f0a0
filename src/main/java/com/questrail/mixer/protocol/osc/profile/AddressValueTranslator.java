package com.questrail.mixer.protocol.osc.profile;

import com.questrail.mixer.api.MixerOperation;
import com.questrail.mixer.protocol.osc.model.OscMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * AddressValueTranslator
 * =============================================================================
 * Maps logical operations onto the wire for one {@link FamilyProfile}.
 *
 * <h2>Order of checks</h2>
 * <ol>
 *   <li>Operation unsupported on this family: the result is empty. Callers
 *       turn that into a silent no-op (mutations) or the operation's
 *       placeholder (queries). Indices are not checked in that case.</li>
 *   <li>Every index is validated against the family's range. Out-of-range
 *       indices throw {@link IllegalArgumentException} before any address is
 *       built.</li>
 *   <li>The value is clamped and encoded, or the reply argument decoded.</li>
 * </ol>
 *
 * <p>Stateless apart from the profile; safe to share between threads.</p>
 */
public final class AddressValueTranslator {

    private final FamilyProfile profile;

    public AddressValueTranslator(FamilyProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    public FamilyProfile profile() {
        return profile;
    }

    /**
     * Build the mutation message for {@code operation}.
     *
     * @return empty when the operation is unsupported on this family
     */
    public <H> Optional<OscMessage> encodeSet(MixerOperation<H> operation, H value, int... indices) {
        Objects.requireNonNull(value, "value");
        return profile.binding(operation)
                .map(binding -> OscMessage.of(binding.address(indices), binding.rule().encode(value)));
    }

    /**
     * Query address for {@code operation}.
     *
     * @return empty when the operation is unsupported on this family
     */
    public Optional<String> queryAddress(MixerOperation<?> operation, int... indices) {
        return profile.binding(operation).map(binding -> binding.address(indices));
    }

    /**
     * Convert the first argument of a reply into the operation's human value.
     *
     * @throws IllegalStateException if the operation is unsupported on this family
     * @throws com.questrail.mixer.api.MixerDecodeException if the argument has the wrong type
     */
    public <H> H decode(MixerOperation<H> operation, Object wire) {
        OperationBinding<H> binding = profile.binding(operation)
                .orElseThrow(() -> new IllegalStateException(operation + " is not supported on " + profile.family()));
        return binding.rule().decode(wire);
    }
}
