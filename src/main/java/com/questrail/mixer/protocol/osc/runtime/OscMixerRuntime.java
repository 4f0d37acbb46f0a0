package com.questrail.mixer.protocol.osc.runtime;

import com.questrail.mixer.api.MixerConnectionException;
import com.questrail.mixer.api.MixerFamily;
import com.questrail.mixer.protocol.osc.codec.impl.JavaOscPacketDecoder;
import com.questrail.mixer.protocol.osc.codec.impl.JavaOscPacketEncoder;
import com.questrail.mixer.protocol.osc.config.MixerConnectionConfig;
import com.questrail.mixer.protocol.osc.config.MixerTimingPolicy;
import com.questrail.mixer.protocol.osc.internal.correlate.RequestCorrelator;
import com.questrail.mixer.protocol.osc.internal.detect.FamilyDetector;
import com.questrail.mixer.protocol.osc.internal.keepalive.KeepaliveScheduler;
import com.questrail.mixer.protocol.osc.internal.time.Cancellable;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicClock;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicScheduler;
import com.questrail.mixer.protocol.osc.internal.time.ScheduledExecutorScheduler;
import com.questrail.mixer.protocol.osc.internal.time.SystemMonotonicClock;
import com.questrail.mixer.protocol.osc.internal.time.SystemWallClock;
import com.questrail.mixer.protocol.osc.internal.time.WallClock;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerObservabilitySink;
import com.questrail.mixer.protocol.osc.observability.MixerSessionEvent;
import com.questrail.mixer.protocol.osc.observability.NullObservabilitySink;
import com.questrail.mixer.protocol.osc.profile.AddressValueTranslator;
import com.questrail.mixer.protocol.osc.profile.FamilyProfile;
import com.questrail.mixer.protocol.osc.profile.FamilyProfiles;
import com.questrail.mixer.protocol.osc.scene.SceneSubsystem;
import com.questrail.mixer.protocol.osc.transport.DatagramEndpoint;
import com.questrail.mixer.protocol.osc.transport.udp.OscUdpTransport;
import com.questrail.mixer.protocol.osc.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OscMixerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one mixer session.
 *
 * <h2>Wiring</h2>
 *
 * <pre>
 *   DatagramEndpoint (Netty)
 *        ⇄ OscUdpTransport (JavaOSC codec)
 *            → RequestCorrelator (waiter table)
 *                ← FamilyDetector, SceneSubsystem, controller queries
 *            ← KeepaliveScheduler (/xremote)
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #connectAsync()} binds the endpoint within the open timeout,
 *       detects the family, records it in the {@link MixerSession} and starts
 *       the keepalive.</li>
 *   <li>{@link #close()} stops the keepalive, fails outstanding queries,
 *       releases the endpoint and shuts down the scheduler thread if this
 *       runtime created it.</li>
 * </ol>
 */
public final class OscMixerRuntime implements AutoCloseable {

    /**
     * Per-family services, available once the family is known.
     */
    public record Established(FamilyProfile profile, AddressValueTranslator translator, SceneSubsystem scenes) {}

    private final MixerConnectionConfig config;
    private final MixerSession session;
    private final OscUdpTransport transport;
    private final RequestCorrelator correlator;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MixerObservabilitySink sink;
    private final List<FamilyProfile> detectionOrder;
    private final ScheduledExecutorService ownedExecutor;

    private final AtomicReference<CompletableFuture<MixerFamily>> connection = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Established established;
    private volatile KeepaliveScheduler keepalive;

    private OscMixerRuntime(Builder b, DatagramEndpoint endpoint, MonotonicScheduler scheduler, ScheduledExecutorService ownedExecutor) {
        this.config = b.config;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.sink = b.sink;
        this.detectionOrder = List.copyOf(b.detectionOrder);
        this.scheduler = scheduler;
        this.ownedExecutor = ownedExecutor;
        this.session = new MixerSession(config.host(), config.port());

        this.correlator = new RequestCorrelator(this::sendOutbound, scheduler, clock, sink, wallClock);
        this.transport = new OscUdpTransport(
                endpoint,
                config.mixerAddress(),
                new JavaOscPacketEncoder(),
                new JavaOscPacketDecoder(),
                correlator,
                sink,
                wallClock);
    }

    public MixerSession session() {
        return session;
    }

    public MixerConnectionConfig config() {
        return config;
    }

    public MixerTimingPolicy timing() {
        return config.timingPolicy();
    }

    public OscUdpTransport transport() {
        return transport;
    }

    public RequestCorrelator correlator() {
        return correlator;
    }

    /**
     * @throws IllegalStateException before a successful connect or after close
     */
    public Established established() {
        Established e = established;
        if (e == null || closed.get()) {
            throw new IllegalStateException("Mixer session " + session.host() + ":" + session.port()
                    + " is not connected");
        }
        return e;
    }

    /**
     * Open the endpoint and detect the family. Idempotent: later calls return
     * the first call's result.
     */
    public CompletableFuture<MixerFamily> connectAsync() {
        CompletableFuture<MixerFamily> result = new CompletableFuture<>();
        if (!connection.compareAndSet(null, result)) {
            return connection.get();
        }
        if (closed.get()) {
            result.completeExceptionally(new MixerConnectionException("Runtime is closed"));
            return result;
        }

        FamilyDetector detector = new FamilyDetector(correlator, detectionOrder, timing().probeTimeout());

        open()
                .thenCompose(ignored -> detector.detect(session.host(), session.port()))
                .thenApply(this::establish)
                .whenComplete((family, failure) -> {
                    if (failure != null) {
                        result.completeExceptionally(unwrap(failure));
                    } else {
                        result.complete(family);
                    }
                });
        return result;
    }

    /**
     * Blocking form of {@link #connectAsync()}.
     *
     * @throws MixerConnectionException if the endpoint cannot be opened
     * @throws com.questrail.mixer.api.MixerNotDetectedException if no family answers
     */
    public MixerFamily connect() {
        try {
            return connectAsync().join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new MixerConnectionException("Connect to " + session.host() + ":" + session.port() + " failed", cause);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        KeepaliveScheduler k = keepalive;
        if (k != null) {
            k.stop();
        }
        correlator.failAll("Session closed");
        transport.stop();
        session.markClosed();

        sink.onSessionEvent(new MixerSessionEvent(
                wallClock.now(), MixerSessionEvent.Kind.CLOSED, session.host(), session.port(), session.family()));

        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private CompletableFuture<Void> open() {
        CompletableFuture<Void> opened = new CompletableFuture<>();
        Cancellable guard;
        try {
            guard = scheduler.scheduleAfter(timing().openTimeout(), clock, () ->
                    opened.completeExceptionally(new MixerConnectionException(
                            "UDP endpoint did not open within " + timing().openTimeout().toMillis() + " ms")));
        } catch (RejectedExecutionException e) {
            opened.completeExceptionally(new MixerConnectionException("Runtime is closed", e));
            return opened;
        }

        transport.ready().whenComplete((ignored, failure) -> {
            guard.cancel();
            if (failure != null) {
                opened.completeExceptionally(failure);
            } else {
                opened.complete(null);
            }
        });

        try {
            transport.start();
        } catch (RuntimeException e) {
            guard.cancel();
            opened.completeExceptionally(new MixerConnectionException("Failed to open UDP endpoint", e));
        }
        return opened;
    }

    private MixerFamily establish(FamilyProfile profile) {
        if (closed.get()) {
            throw new MixerConnectionException("Runtime closed during family detection");
        }

        session.establish(profile);
        established = new Established(
                profile,
                new AddressValueTranslator(profile),
                new SceneSubsystem(this::sendOutbound, correlator, profile.scenes(), timing().queryTimeout()));

        sink.onSessionEvent(new MixerSessionEvent(
                wallClock.now(), MixerSessionEvent.Kind.FAMILY_DETECTED, session.host(), session.port(), profile.family()));

        KeepaliveScheduler k = new KeepaliveScheduler(
                this::sendOutbound,
                profile.keepaliveAddress(),
                timing().keepaliveInterval(),
                scheduler,
                clock,
                sink,
                wallClock);
        keepalive = k;
        k.start();
        sink.onSessionEvent(new MixerSessionEvent(
                wallClock.now(), MixerSessionEvent.Kind.KEEPALIVE_STARTED, session.host(), session.port(), profile.family()));

        return profile.family();
    }

    private void sendOutbound(OscMessage message) {
        transport.send(message);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MixerConnectionConfig config = MixerConnectionConfig.builder().build();
        private MixerObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private DatagramEndpoint endpoint;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private List<FamilyProfile> detectionOrder = FamilyProfiles.detectionOrder();

        public Builder withConfig(MixerConnectionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(MixerObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Replace the Netty endpoint, typically with a test double.
         */
        public Builder withEndpoint(DatagramEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Use an external clock and scheduler. The runtime then owns no
         * threads of its own.
         */
        public Builder withTime(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withDetectionOrder(List<FamilyProfile> detectionOrder) {
            this.detectionOrder = detectionOrder;
            return this;
        }

        public OscMixerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(detectionOrder, "detectionOrder");

            DatagramEndpoint ep = endpoint != null ? endpoint : new NettyUdpDatagramEndpoint(config.bindAddress());

            ScheduledExecutorService owned = null;
            MonotonicScheduler sched = scheduler;
            if (sched == null) {
                owned = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "mixer-osc-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                sched = new ScheduledExecutorScheduler(owned, clock);
            }

            return new OscMixerRuntime(this, ep, sched, owned);
        }
    }
}
