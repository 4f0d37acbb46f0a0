package com.questrail.mixer.protocol.osc.observability;

/**
 * Receives observability events from the mixer session core.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the caller's thread, the scheduler thread or the
 * transport event loop; implementations must not block.</p>
 */
public interface MixerObservabilitySink {
    /**
     * Session lifecycle: family detection, keepalive start, teardown.
     */
    void onSessionEvent(MixerSessionEvent event);

    /**
     * Query lifecycle: sent, resolved, shared with an in-flight query, timed
     * out, or an inbound message that matched no query.
     */
    void onQueryEvent(MixerQueryEvent event);

    /**
     * Transport lifecycle and datagram-level anomalies.
     */
    void onTransportEvent(MixerTransportEvent event);

    /**
     * An error or anomaly that did not surface to a caller.
     */
    void onError(MixerErrorEvent event);
}
