package com.questrail.mixer.protocol.osc.internal.keepalive;

import com.questrail.mixer.api.MixerConnectionException;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicScheduler;
import com.questrail.mixer.protocol.osc.internal.time.SystemWallClock;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerErrorEvent;
import com.questrail.mixer.protocol.osc.observability.RecordingObservabilitySink;
import com.questrail.mixer.protocol.osc.time.DeterministicScheduler;
import com.questrail.mixer.protocol.osc.time.ManualMonotonicClock;
import com.questrail.mixer.protocol.osc.transport.OscSender;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeepaliveSchedulerTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private List<OscMessage> sent;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        sent = new ArrayList<>();
    }

    private KeepaliveScheduler keepalive(OscSender sender) {
        return new KeepaliveScheduler(sender, "/xremote", Duration.ofSeconds(9),
                scheduler, clock, sink, SystemWallClock.INSTANCE);
    }

    @Test
    void refreshIsSentImmediatelyThenEveryInterval() {
        KeepaliveScheduler k = keepalive(sent::add);

        k.start();
        assertEquals(List.of(OscMessage.of("/xremote")), sent);

        scheduler.advanceMillis(8_999);
        assertEquals(1, sent.size());

        scheduler.advanceMillis(1);
        assertEquals(2, sent.size());

        scheduler.advanceMillis(9_000 * 3);
        assertEquals(5, sent.size());
        assertTrue(k.isRunning());
    }

    @Test
    void cadenceDoesNotDriftWhenTheClockJumpsPastSeveralTicks() {
        KeepaliveScheduler k = keepalive(sent::add);
        k.start();

        // 30 s late: the three missed ticks are caught up, the next one stays on the 9 s grid
        scheduler.advanceMillis(30_000);
        assertEquals(4, sent.size());

        scheduler.advanceMillis(5_999);
        assertEquals(4, sent.size());
        scheduler.advanceMillis(1);
        assertEquals(5, sent.size());
    }

    @Test
    void sendFailuresAreReportedAndTheCadenceContinues() {
        AtomicInteger attempts = new AtomicInteger();
        KeepaliveScheduler k = keepalive(message -> {
            if (attempts.incrementAndGet() == 2) {
                throw new MixerConnectionException("network unreachable");
            }
            sent.add(message);
        });

        k.start();
        scheduler.advanceMillis(9_000);
        scheduler.advanceMillis(9_000);

        assertEquals(3, attempts.get());
        assertEquals(2, sent.size());
        assertEquals(1, sink.eventsOfType(MixerErrorEvent.class).size());
    }

    @Test
    void stopCancelsFurtherRefreshes() {
        KeepaliveScheduler k = keepalive(sent::add);
        k.start();

        k.stop();
        scheduler.advanceMillis(60_000);

        assertEquals(1, sent.size());
        assertFalse(k.isRunning());
    }

    @Test
    void startIsIdempotent() {
        KeepaliveScheduler k = keepalive(sent::add);
        k.start();
        k.start();

        assertEquals(1, sent.size());
        assertEquals(1, scheduler.pendingTasks());
    }

    @Test
    void intervalMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new KeepaliveScheduler(
                sent::add, "/xremote", Duration.ZERO, scheduler, clock, sink, SystemWallClock.INSTANCE));
    }

    @Test
    void stoppedSchedulerEndsTheCadenceAndIsReported() {
        MonotonicScheduler rejecting = (deadline, task) -> {
            throw new RejectedExecutionException("shut down");
        };
        KeepaliveScheduler k = new KeepaliveScheduler(sent::add, "/xremote", Duration.ofSeconds(9),
                rejecting, clock, sink, SystemWallClock.INSTANCE);

        k.start();

        assertEquals(1, sent.size());
        assertFalse(k.isRunning());
        assertInstanceOf(RejectedExecutionException.class,
                sink.eventsOfType(MixerErrorEvent.class).get(0).cause());
    }
}
