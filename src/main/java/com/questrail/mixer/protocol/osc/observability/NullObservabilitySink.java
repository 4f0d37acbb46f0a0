package com.questrail.mixer.protocol.osc.observability;

/**
 * No-op implementation of MixerObservabilitySink.
 */
public final class NullObservabilitySink implements MixerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionEvent(MixerSessionEvent event) {}

    @Override
    public void onQueryEvent(MixerQueryEvent event) {}

    @Override
    public void onTransportEvent(MixerTransportEvent event) {}

    @Override
    public void onError(MixerErrorEvent event) {}
}
