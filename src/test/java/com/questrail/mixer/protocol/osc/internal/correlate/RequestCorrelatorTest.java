package com.questrail.mixer.protocol.osc.internal.correlate;

import com.questrail.mixer.api.MixerConnectionException;
import com.questrail.mixer.api.MixerQueryTimeoutException;
import com.questrail.mixer.protocol.osc.internal.time.ScheduledExecutorScheduler;
import com.questrail.mixer.protocol.osc.internal.time.SystemMonotonicClock;
import com.questrail.mixer.protocol.osc.internal.time.SystemWallClock;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerQueryEvent;
import com.questrail.mixer.protocol.osc.observability.RecordingObservabilitySink;
import com.questrail.mixer.protocol.osc.time.DeterministicScheduler;
import com.questrail.mixer.protocol.osc.time.ManualMonotonicClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RequestCorrelatorTest {

    private static final Duration TIMEOUT = Duration.ofMillis(1000);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private List<OscMessage> sent;
    private RequestCorrelator correlator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        sent = new CopyOnWriteArrayList<>();
        correlator = new RequestCorrelator(sent::add, scheduler, clock, sink, SystemWallClock.INSTANCE);
    }

    @Test
    void replyResolvesTheWaiterWithItsFirstArgument() throws Exception {
        CompletableFuture<Object> fader = correlator.query("/ch/01/mix/fader", TIMEOUT);

        assertEquals(List.of(OscMessage.of("/ch/01/mix/fader")), sent);
        assertFalse(fader.isDone());

        correlator.onMessage(OscMessage.of("/ch/01/mix/fader", 0.75f));

        assertEquals(0.75f, fader.get());
        assertEquals(0, correlator.pendingCount());
        assertEquals(0, scheduler.pendingTasks(), "deadline should be cancelled");
    }

    @Test
    void resolutionIsSingleShot() throws Exception {
        CompletableFuture<Object> fader = correlator.query("/ch/01/mix/fader", TIMEOUT);

        correlator.onMessage(OscMessage.of("/ch/01/mix/fader", 0.5f));
        correlator.onMessage(OscMessage.of("/ch/01/mix/fader", 0.9f));

        assertEquals(0.5f, fader.get());
        assertEquals(List.of(MixerQueryEvent.Outcome.SENT, MixerQueryEvent.Outcome.RESOLVED,
                MixerQueryEvent.Outcome.UNMATCHED), sink.queryOutcomes("/ch/01/mix/fader"));
    }

    @Test
    void replyToASubPathMatchesByPrefix() throws Exception {
        CompletableFuture<Object> snap = correlator.query("/-snap/005", TIMEOUT);
        CompletableFuture<Object> other = correlator.query("/-snap/00", TIMEOUT);

        correlator.onMessage(OscMessage.of("/-snap/005/name", "Sunday"));

        assertEquals("Sunday", snap.get());
        assertFalse(other.isDone(), "\"/-snap/00\" is not a path prefix of /-snap/005/name");
    }

    @Test
    void exactMatchWinsOverPrefix() throws Exception {
        CompletableFuture<Object> parent = correlator.query("/ch/01", TIMEOUT);
        CompletableFuture<Object> exact = correlator.query("/ch/01/mix", TIMEOUT);

        correlator.onMessage(OscMessage.of("/ch/01/mix", 1));

        assertEquals(1, exact.get());
        assertFalse(parent.isDone());
    }

    @Test
    void repliesWithoutArgumentsAreIgnored() {
        CompletableFuture<Object> info = correlator.query("/xinfo", TIMEOUT);

        correlator.onMessage(OscMessage.of("/xinfo"));

        assertFalse(info.isDone());
        assertEquals(1, correlator.pendingCount());
    }

    @Test
    void concurrentQueriesToDistinctAddressesResolveIndependently() throws Exception {
        CompletableFuture<Object> ch1 = correlator.query("/ch/01/mix/fader", TIMEOUT);
        CompletableFuture<Object> ch2 = correlator.query("/ch/02/mix/fader", TIMEOUT);
        CompletableFuture<Object> name = correlator.query("/ch/02/config/name", TIMEOUT);

        // Replies arrive out of order
        correlator.onMessage(OscMessage.of("/ch/02/config/name", "Bass"));
        correlator.onMessage(OscMessage.of("/ch/02/mix/fader", 0.25f));
        correlator.onMessage(OscMessage.of("/ch/01/mix/fader", 0.75f));

        assertEquals(0.75f, ch1.get());
        assertEquals(0.25f, ch2.get());
        assertEquals("Bass", name.get());
    }

    @Test
    void queryTimesOutAtItsDeadlineAndNotBefore() {
        CompletableFuture<Object> fader = correlator.query("/ch/01/mix/fader", TIMEOUT);

        scheduler.advanceMillis(999);
        assertFalse(fader.isDone());

        scheduler.advanceMillis(1);
        assertTrue(fader.isCompletedExceptionally());

        ExecutionException e = assertThrows(ExecutionException.class, fader::get);
        MixerQueryTimeoutException timeout = assertInstanceOf(MixerQueryTimeoutException.class, e.getCause());
        assertEquals("/ch/01/mix/fader", timeout.address());
        assertEquals("Timeout waiting for response from /ch/01/mix/fader after 1000 ms", timeout.getMessage());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void lateReplyAfterTimeoutIsDropped() {
        CompletableFuture<Object> fader = correlator.query("/ch/01/mix/fader", TIMEOUT);
        scheduler.advanceMillis(1000);

        correlator.onMessage(OscMessage.of("/ch/01/mix/fader", 0.75f));

        assertTrue(fader.isCompletedExceptionally());
        assertEquals(MixerQueryEvent.Outcome.UNMATCHED,
                sink.queryOutcomes("/ch/01/mix/fader").get(2));
    }

    @Test
    void secondQueryToTheSameAddressSharesTheInFlightResult() throws Exception {
        CompletableFuture<Object> first = correlator.query("/lr/mix/fader", TIMEOUT);
        CompletableFuture<Object> second = correlator.query("/lr/mix/fader", TIMEOUT);

        assertEquals(1, sent.size(), "no second datagram for a shared query");
        assertNotSame(first, second);

        correlator.onMessage(OscMessage.of("/lr/mix/fader", 0.6f));

        assertEquals(0.6f, first.get());
        assertEquals(0.6f, second.get());
    }

    @Test
    void sharedQueriesTimeOutTogether() {
        CompletableFuture<Object> first = correlator.query("/lr/mix/fader", TIMEOUT);
        CompletableFuture<Object> second = correlator.query("/lr/mix/fader", TIMEOUT);

        scheduler.advanceMillis(1000);

        assertTrue(first.isCompletedExceptionally());
        assertTrue(second.isCompletedExceptionally());
    }

    @Test
    void cancellingOneCallerDoesNotAffectTheOther() throws Exception {
        CompletableFuture<Object> first = correlator.query("/lr/mix/fader", TIMEOUT);
        CompletableFuture<Object> second = correlator.query("/lr/mix/fader", TIMEOUT);

        first.cancel(false);
        correlator.onMessage(OscMessage.of("/lr/mix/fader", 0.6f));

        assertEquals(0.6f, second.get());
    }

    @Test
    void sendFailureFailsTheQueryAndFreesTheAddress() {
        RequestCorrelator failing = new RequestCorrelator(
                message -> { throw new MixerConnectionException("OSC transport is not open"); },
                scheduler, clock, sink, SystemWallClock.INSTANCE);

        CompletableFuture<Object> fader = failing.query("/ch/01/mix/fader", TIMEOUT);

        ExecutionException e = assertThrows(ExecutionException.class, fader::get);
        assertInstanceOf(MixerConnectionException.class, e.getCause());
        assertEquals(0, failing.pendingCount());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void failAllCompletesEveryWaiter() {
        CompletableFuture<Object> a = correlator.query("/ch/01/mix/fader", TIMEOUT);
        CompletableFuture<Object> b = correlator.query("/ch/02/mix/fader", TIMEOUT);

        correlator.failAll("Session closed");

        ExecutionException e = assertThrows(ExecutionException.class, a::get);
        assertInstanceOf(MixerConnectionException.class, e.getCause());
        assertTrue(b.isCompletedExceptionally());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void realTimeTimeoutFallsWithinItsWindow() throws Exception {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            RequestCorrelator real = new RequestCorrelator(
                    sent::add,
                    new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE),
                    SystemMonotonicClock.INSTANCE,
                    sink,
                    SystemWallClock.INSTANCE);

            long start = System.nanoTime();
            CompletableFuture<Object> probe = real.query("/xinfo", Duration.ofMillis(100));
            ExecutionException e = assertThrows(ExecutionException.class, () -> probe.get(2, TimeUnit.SECONDS));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertInstanceOf(MixerQueryTimeoutException.class, e.getCause());
            assertTrue(elapsedMillis >= 100, "timed out early: " + elapsedMillis + " ms");
            assertTrue(elapsedMillis < 1500, "timed out late: " + elapsedMillis + " ms");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void queryOnStoppedSchedulerFailsInsteadOfWaitingForever() {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        executor.shutdown();
        RequestCorrelator stopped = new RequestCorrelator(
                sent::add,
                new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE),
                SystemMonotonicClock.INSTANCE,
                sink,
                SystemWallClock.INSTANCE);

        CompletableFuture<Object> fader = stopped.query("/ch/01/mix/fader", Duration.ofMillis(50));

        assertTrue(fader.isDone());
        ExecutionException e = assertThrows(ExecutionException.class, fader::get);
        assertInstanceOf(MixerConnectionException.class, e.getCause());
        assertEquals(0, stopped.pendingCount());
        assertTrue(sent.isEmpty());
    }
}
