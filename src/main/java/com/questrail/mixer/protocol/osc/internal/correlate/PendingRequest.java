package com.questrail.mixer.protocol.osc.internal.correlate;

import com.questrail.mixer.protocol.osc.internal.time.Cancellable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One in-flight query: the address it waits on, its deadline handle and the
 * future shared by every caller waiting on that address.
 */
final class PendingRequest {

    private final String address;
    private final Duration timeout;
    private final CompletableFuture<Object> result = new CompletableFuture<>();

    private volatile Cancellable deadline;

    PendingRequest(String address, Duration timeout) {
        this.address = Objects.requireNonNull(address, "address");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    String address() {
        return address;
    }

    Duration timeout() {
        return timeout;
    }

    CompletableFuture<Object> result() {
        return result;
    }

    void armDeadline(Cancellable deadline) {
        this.deadline = deadline;
    }

    void cancelDeadline() {
        Cancellable d = deadline;
        if (d != null) {
            d.cancel();
        }
    }

    /**
     * A caller-private view of the shared result. Cancelling it does not
     * affect other callers, and failures arrive unwrapped.
     */
    CompletableFuture<Object> view() {
        CompletableFuture<Object> view = new CompletableFuture<>();
        result.whenComplete((value, failure) -> {
            if (failure != null) {
                view.completeExceptionally(failure);
            } else {
                view.complete(value);
            }
        });
        return view;
    }
}
