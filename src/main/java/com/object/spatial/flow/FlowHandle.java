package com.object.spatial.flow;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a background task launched with {@code flow}; joined with {@code await}.
 */
public final class FlowHandle<T> {

    private final long id;
    private final CompletableFuture<T> future;

    FlowHandle(long id, CompletableFuture<T> future) {
        this.id = id;
        this.future = future;
    }

    public long getId() {
        return id;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * The underlying future, for callers composing with other asynchronous work.
     */
    public CompletableFuture<T> toCompletableFuture() {
        return future;
    }

    @Override
    public String toString() {
        return "FlowHandle{id=" + id + ", done=" + future.isDone() + "}";
    }
}
