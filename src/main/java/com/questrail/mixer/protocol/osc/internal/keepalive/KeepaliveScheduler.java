package com.questrail.mixer.protocol.osc.internal.keepalive;

import com.questrail.mixer.protocol.osc.internal.time.Cancellable;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicClock;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicScheduler;
import com.questrail.mixer.protocol.osc.internal.time.WallClock;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerErrorEvent;
import com.questrail.mixer.protocol.osc.observability.MixerObservabilitySink;
import com.questrail.mixer.protocol.osc.transport.OscSender;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

/**
 * KeepaliveScheduler
 * =============================================================================
 * Keeps the mixer's push-update subscription alive.
 *
 * <p>Mixers stop pushing control changes to a client roughly ten seconds
 * after its last subscription refresh. {@link #start()} sends the refresh
 * immediately and then on a fixed monotonic cadence until {@link #stop()}.</p>
 *
 * <h2>Failure policy</h2>
 * A failed send is reported to the observability sink and the cadence
 * continues. There is no back-off and no give-up.
 */
public final class KeepaliveScheduler {

    private final OscSender sender;
    private final String address;
    private final Duration interval;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final MixerObservabilitySink sink;
    private final WallClock wallClock;

    private final Object lock = new Object();
    private boolean started;
    private boolean stopped;
    private long nextDeadlineNanos;
    private Cancellable pending;

    public KeepaliveScheduler(OscSender sender,
                              String address,
                              Duration interval,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              MixerObservabilitySink sink,
                              WallClock wallClock) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.address = Objects.requireNonNull(address, "address");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Send the first refresh now and schedule the rest. Calling it again has no
     * effect.
     */
    public void start() {
        synchronized (lock) {
            if (started || stopped) {
                return;
            }
            started = true;
            nextDeadlineNanos = clock.nowNanos();
        }
        tick();
    }

    public void stop() {
        Cancellable toCancel;
        synchronized (lock) {
            stopped = true;
            toCancel = pending;
            pending = null;
        }
        if (toCancel != null) {
            toCancel.cancel();
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return started && !stopped;
        }
    }

    private void tick() {
        RejectedExecutionException rejected;
        synchronized (lock) {
            if (stopped) {
                return;
            }
        }

        try {
            sender.send(OscMessage.of(address));
        } catch (RuntimeException e) {
            sink.onError(new MixerErrorEvent(wallClock.now(), "Subscription refresh " + address + " failed", e));
        }

        synchronized (lock) {
            if (stopped) {
                return;
            }
            nextDeadlineNanos += interval.toNanos();
            try {
                pending = scheduler.scheduleAtNanos(nextDeadlineNanos, this::tick);
                return;
            } catch (RejectedExecutionException e) {
                stopped = true;
                pending = null;
                rejected = e;
            }
        }
        sink.onError(new MixerErrorEvent(wallClock.now(), "Subscription refresh " + address + " stopped", rejected));
    }
}
