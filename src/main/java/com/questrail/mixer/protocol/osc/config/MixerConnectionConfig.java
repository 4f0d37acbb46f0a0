package com.questrail.mixer.protocol.osc.config;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for one mixer session.
 *
 * <p>The family is never configured; it is detected on connect.</p>
 *
 * @param host        mixer host name or IP address
 * @param port        mixer OSC port (10023 on full-size consoles, 10024 on
 *                    rack mixers)
 * @param bindAddress local address to bind; port 0 selects an ephemeral port
 */
public record MixerConnectionConfig(
    String host,
    int port,
    InetSocketAddress bindAddress,
    MixerTimingPolicy timingPolicy
) {
    public static final String ENV_HOST = "OSC_HOST";
    public static final String ENV_PORT = "OSC_PORT";

    public static final String DEFAULT_HOST = "192.168.1.17";
    public static final int DEFAULT_PORT = 10024;

    public MixerConnectionConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1..65535 (was " + port + ")");
        }
    }

    public InetSocketAddress mixerAddress() {
        return new InetSocketAddress(host, port);
    }

    /**
     * Read {@code OSC_HOST} and {@code OSC_PORT} from the given environment,
     * falling back to the defaults for missing or blank entries.
     *
     * @throws IllegalArgumentException if {@code OSC_PORT} is not a number
     */
    public static MixerConnectionConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        Builder builder = builder();
        String host = env.get(ENV_HOST);
        if (host != null && !host.isBlank()) {
            builder.withHost(host.trim());
        }
        String port = env.get(ENV_PORT);
        if (port != null && !port.isBlank()) {
            try {
                builder.withPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_PORT + " is not a port number: " + port, e);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private MixerTimingPolicy timingPolicy = MixerTimingPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withTimingPolicy(MixerTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public MixerConnectionConfig build() {
            return new MixerConnectionConfig(host, port, bindAddress, timingPolicy);
        }
    }
}
