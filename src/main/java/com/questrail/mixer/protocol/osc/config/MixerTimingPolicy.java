package com.questrail.mixer.protocol.osc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * MixerTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for a mixer session.
 *
 * <p>This is <em>operational only</em>: it controls reply deadlines and
 * cadence, never addresses or value encodings.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>queryTimeout</b>: How long a query waits for its reply before it
 *       fails with {@code MixerQueryTimeoutException}. There is no retry.</li>
 *   <li><b>probeTimeout</b>: Reply window for each identification probe during
 *       family detection. Shorter than {@code queryTimeout} so that detecting
 *       the second family does not take twice as long.</li>
 *   <li><b>keepaliveInterval</b>: Period of the {@code /xremote} subscription
 *       refresh. Mixers drop the subscription after about 10 s of silence.</li>
 *   <li><b>openTimeout</b>: How long the UDP endpoint may take to bind.</li>
 * </ul>
 */
public record MixerTimingPolicy(
        Duration queryTimeout,
        Duration probeTimeout,
        Duration keepaliveInterval,
        Duration openTimeout
) {
    public MixerTimingPolicy {
        Objects.requireNonNull(queryTimeout, "queryTimeout");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        Objects.requireNonNull(keepaliveInterval, "keepaliveInterval");
        Objects.requireNonNull(openTimeout, "openTimeout");

        if (queryTimeout.isNegative()) {
            throw new IllegalArgumentException("queryTimeout must be non-negative");
        }
        if (probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be non-negative");
        }
        if (keepaliveInterval.isNegative() || keepaliveInterval.isZero()) {
            throw new IllegalArgumentException("keepaliveInterval must be positive");
        }
        if (openTimeout.isNegative()) {
            throw new IllegalArgumentException("openTimeout must be non-negative");
        }
    }

    /**
     * Defaults used against real consoles:
     * <ul>
     *   <li>queryTimeout: 1000ms</li>
     *   <li>probeTimeout: 500ms</li>
     *   <li>keepaliveInterval: 9s</li>
     *   <li>openTimeout: 5s</li>
     * </ul>
     */
    public static MixerTimingPolicy defaults() {
        return new MixerTimingPolicy(
                Duration.ofMillis(1000),
                Duration.ofMillis(500),
                Duration.ofSeconds(9),
                Duration.ofSeconds(5)
        );
    }

    public MixerTimingPolicy withQueryTimeout(Duration queryTimeout) {
        return new MixerTimingPolicy(queryTimeout, probeTimeout, keepaliveInterval, openTimeout);
    }

    public MixerTimingPolicy withProbeTimeout(Duration probeTimeout) {
        return new MixerTimingPolicy(queryTimeout, probeTimeout, keepaliveInterval, openTimeout);
    }
}
