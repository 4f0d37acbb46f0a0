package com.questrail.mixer.protocol.osc.internal.correlate;

import com.questrail.mixer.api.MixerConnectionException;
import com.questrail.mixer.api.MixerQueryTimeoutException;
import com.questrail.mixer.protocol.osc.internal.time.Cancellable;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicClock;
import com.questrail.mixer.protocol.osc.internal.time.MonotonicScheduler;
import com.questrail.mixer.protocol.osc.internal.time.WallClock;
import com.questrail.mixer.protocol.osc.model.OscMessage;
import com.questrail.mixer.protocol.osc.observability.MixerObservabilitySink;
import com.questrail.mixer.protocol.osc.observability.MixerQueryEvent;
import com.questrail.mixer.protocol.osc.transport.OscInboundHandler;
import com.questrail.mixer.protocol.osc.transport.OscSender;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * RequestCorrelator
 * =============================================================================
 * Pairs fire-and-forget OSC queries with the single reply each one expects.
 *
 * <h2>Why correlation is by address</h2>
 * OSC over UDP has no request identifiers. A mixer answers a query by sending
 * a message to the <em>same address</em> carrying the current value, so the
 * address is the only correlation key available.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>The waiter is registered <strong>before</strong> the query datagram is
 *       sent, so a fast reply can never be missed.</li>
 *   <li>A reply matches a waiter by exact address first. Failing that, it
 *       matches a waiter whose address is a path prefix of the reply address
 *       ({@code /-snap/005} matches {@code /-snap/005/name}); the longest
 *       such prefix wins.</li>
 *   <li>Resolution is single-shot. Later messages for the same address are
 *       treated as unsolicited.</li>
 *   <li>Messages without arguments are ignored: they are queries, not
 *       replies.</li>
 *   <li>A query for an address that already has a waiter shares the
 *       in-flight result. No second datagram is sent, since the mixer's
 *       answer would be indistinguishable anyway.</li>
 *   <li>On deadline expiry the waiter is removed and its future fails with
 *       {@link MixerQueryTimeoutException}. Nothing is retried.</li>
 * </ul>
 *
 * <p>The waiter table belongs to this instance; several sessions each have
 * their own correlator. All methods are thread-safe.</p>
 */
public final class RequestCorrelator implements OscInboundHandler {

    private final OscSender sender;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final MixerObservabilitySink sink;
    private final WallClock wallClock;

    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public RequestCorrelator(OscSender sender,
                             MonotonicScheduler scheduler,
                             MonotonicClock clock,
                             MixerObservabilitySink sink,
                             WallClock wallClock) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Send {@code address} with {@code arguments} and wait for the reply.
     *
     * @return future completed with the first argument of the reply, or failed
     *         with {@link MixerQueryTimeoutException} after {@code timeout}, or
     *         with the send failure if the datagram could not be sent
     */
    public CompletableFuture<Object> query(String address, List<Object> arguments, Duration timeout) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(timeout, "timeout");

        OscMessage message = new OscMessage(address, arguments);

        PendingRequest request = new PendingRequest(address, timeout);
        PendingRequest inFlight = pending.putIfAbsent(address, request);
        if (inFlight != null) {
            emit(address, MixerQueryEvent.Outcome.SHARED);
            return inFlight.view();
        }

        Cancellable deadline;
        try {
            deadline = scheduler.scheduleAfter(timeout, clock, () -> expire(request));
        } catch (RejectedExecutionException e) {
            pending.remove(address, request);
            request.result().completeExceptionally(new MixerConnectionException(
                    "Session scheduler is stopped; cannot wait for " + address, e));
            return request.view();
        }
        request.armDeadline(deadline);

        try {
            sender.send(message);
        } catch (RuntimeException e) {
            if (pending.remove(address, request)) {
                request.cancelDeadline();
            }
            request.result().completeExceptionally(e);
            return request.view();
        }

        emit(address, MixerQueryEvent.Outcome.SENT);
        return request.view();
    }

    public CompletableFuture<Object> query(String address, Duration timeout) {
        return query(address, List.of(), timeout);
    }

    /**
     * Number of queries currently waiting for a reply.
     */
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void onMessage(OscMessage message) {
        Optional<Object> value = message.firstArgument();
        if (value.isEmpty()) {
            return;
        }

        PendingRequest request = match(message.address());
        if (request == null) {
            emit(message.address(), MixerQueryEvent.Outcome.UNMATCHED);
            return;
        }

        if (pending.remove(request.address(), request)) {
            request.cancelDeadline();
            request.result().complete(value.get());
            emit(request.address(), MixerQueryEvent.Outcome.RESOLVED);
        }
    }

    /**
     * Fail every waiting query. Used at session teardown.
     */
    public void failAll(String reason) {
        List<PendingRequest> drained = new ArrayList<>(pending.values());
        for (PendingRequest request : drained) {
            if (pending.remove(request.address(), request)) {
                request.cancelDeadline();
                request.result().completeExceptionally(new MixerConnectionException(
                        reason + " while waiting for " + request.address()));
            }
        }
    }

    private PendingRequest match(String address) {
        PendingRequest exact = pending.get(address);
        if (exact != null) {
            return exact;
        }

        PendingRequest best = null;
        for (PendingRequest candidate : pending.values()) {
            String key = candidate.address();
            if (address.startsWith(key + "/")
                    && (best == null || key.length() > best.address().length())) {
                best = candidate;
            }
        }
        return best;
    }

    private void expire(PendingRequest request) {
        if (!pending.remove(request.address(), request)) {
            return;
        }
        emit(request.address(), MixerQueryEvent.Outcome.TIMED_OUT);
        request.result().completeExceptionally(
                new MixerQueryTimeoutException(request.address(), request.timeout()));
    }

    private void emit(String address, MixerQueryEvent.Outcome outcome) {
        sink.onQueryEvent(new MixerQueryEvent(wallClock.now(), address, outcome));
    }
}
