package com.questrail.mixer.protocol.osc.internal.detect;

import com.questrail.mixer.api.MixerNotDetectedException;
import com.questrail.mixer.api.MixerQueryTimeoutException;
import com.questrail.mixer.protocol.osc.internal.correlate.RequestCorrelator;
import com.questrail.mixer.protocol.osc.profile.FamilyProfile;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * FamilyDetector
 * =============================================================================
 * Determines which family the mixer belongs to by probing each profile's
 * identification address, in order, with a short timeout.
 *
 * <p>The first profile whose probe is answered wins. If every probe times out
 * the result fails with {@link MixerNotDetectedException}. Any other failure
 * (the transport closing, for instance) ends detection immediately. Detection
 * is never retried here.</p>
 */
public final class FamilyDetector {

    private final RequestCorrelator correlator;
    private final List<FamilyProfile> detectionOrder;
    private final Duration probeTimeout;

    public FamilyDetector(RequestCorrelator correlator, List<FamilyProfile> detectionOrder, Duration probeTimeout) {
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.detectionOrder = List.copyOf(detectionOrder);
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
        if (this.detectionOrder.isEmpty()) {
            throw new IllegalArgumentException("detectionOrder must not be empty");
        }
    }

    /**
     * @param host mixer host, for the not-detected message only
     * @param port mixer port, for the not-detected message only
     */
    public CompletableFuture<FamilyProfile> detect(String host, int port) {
        return probe(0, host, port);
    }

    private CompletableFuture<FamilyProfile> probe(int position, String host, int port) {
        if (position >= detectionOrder.size()) {
            List<String> probed = detectionOrder.stream().map(FamilyProfile::identificationAddress).toList();
            return CompletableFuture.failedFuture(new MixerNotDetectedException(host, port, probed));
        }

        FamilyProfile candidate = detectionOrder.get(position);
        return correlator.query(candidate.identificationAddress(), probeTimeout)
                .handle((reply, failure) -> {
                    if (failure == null) {
                        return CompletableFuture.completedFuture(candidate);
                    }
                    if (unwrap(failure) instanceof MixerQueryTimeoutException) {
                        return probe(position + 1, host, port);
                    }
                    return CompletableFuture.<FamilyProfile>failedFuture(unwrap(failure));
                })
                .thenCompose(next -> next);
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
