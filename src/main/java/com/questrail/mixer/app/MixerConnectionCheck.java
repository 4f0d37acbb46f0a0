package com.questrail.mixer.app;

import com.questrail.mixer.api.MixerException;
import com.questrail.mixer.api.MixerFamily;
import com.questrail.mixer.api.MixerStatus;
import com.questrail.mixer.protocol.osc.OscMixerController;
import com.questrail.mixer.protocol.osc.config.MixerConnectionConfig;
import com.questrail.mixer.protocol.osc.observability.Slf4jMixerObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

/**
 * Command-line check that a mixer is reachable.
 *
 * <p>Reads {@code OSC_HOST} and {@code OSC_PORT} from the environment,
 * detects the family, logs the status and reads channel 1's fader. Exits with
 * status 1 when the mixer cannot be reached.</p>
 */
public final class MixerConnectionCheck {
    private static final Logger log = LoggerFactory.getLogger(MixerConnectionCheck.class);

    private MixerConnectionCheck() {}

    public static void main(String[] args) {
        System.exit(run(MixerConnectionConfig.fromEnvironment(System.getenv())));
    }

    static int run(MixerConnectionConfig config) {
        log.info("Checking mixer at {}:{}", config.host(), config.port());

        try (OscMixerController mixer = new OscMixerController(config, new Slf4jMixerObservabilitySink())) {
            MixerFamily family = mixer.connect();
            log.info("Connected, family {}", family.label());

            MixerStatus status = mixer.status().join();
            log.info("Status: {}", status);

            try {
                double level = mixer.getFader(1).join();
                log.info("Channel 1 fader: {}%", String.format("%.1f", level * 100.0));
            } catch (CompletionException e) {
                log.warn("Could not read channel 1 fader: {}", e.getCause().getMessage());
            }
            return 0;
        } catch (MixerException e) {
            log.error("Connection failed: {}", e.getMessage());
            log.error("Check that the mixer is powered on, that {} is reachable on the same network, "
                    + "and that UDP port {} is not blocked", config.host(), config.port());
            return 1;
        }
    }
}
