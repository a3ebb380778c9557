package dev.badgersnacks.packmigrator.agents;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller's side of a submitted job. Cancelling only raises a flag; the job stops at its next
 * checkpoint and its future completes exceptionally with the cancellation.
 */
public final class ConversionHandle<T> {

    private final AtomicBoolean cancelled;
    private final CompletableFuture<JobResult<T>> result;

    ConversionHandle(AtomicBoolean cancelled, CompletableFuture<JobResult<T>> result) {
        this.cancelled = cancelled;
        this.result = result;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public CompletableFuture<JobResult<T>> result() {
        return result;
    }
}
