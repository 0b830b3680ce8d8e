package com.object.spatial.api;

import com.object.spatial.spawn.SpawnCoordinator;
import com.object.spatial.spawn.SpawnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-pool implementation of {@link AsyncSpawner}.
 *
 * <p>A timeout only fails the returned future; the walker itself keeps running
 * until it finishes or disengages.</p>
 */
public class AsyncSpawnerImpl implements AsyncSpawner {
    private static final Logger log = LoggerFactory.getLogger(AsyncSpawnerImpl.class);

    private final SpawnCoordinator coordinator;
    private final ExecutorService executor;
    private final long timeoutMs;

    /**
     * @param timeoutMs per-spawn timeout in milliseconds; 0 means none
     */
    public AsyncSpawnerImpl(SpawnCoordinator coordinator, long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        this.coordinator = coordinator;
        this.timeoutMs = timeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "osp-walker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public CompletableFuture<SpawnResult> spawnAsync(SpawnRequest request) {
        CompletableFuture<SpawnResult> future = CompletableFuture.supplyAsync(
                () -> coordinator.spawn(request), executor);
        return timeoutMs > 0 ? future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS) : future;
    }

    @Override
    public CompletableFuture<List<SpawnResult>> spawnAllAsync(List<SpawnRequest> requests) {
        List<CompletableFuture<SpawnResult>> futures = requests.stream()
                .map(this::spawnAsync)
                .toList();
        return allOf(futures);
    }

    @Override
    public CompletableFuture<List<SpawnResult>> spawnAllAsync(List<SpawnRequest> requests, int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        Semaphore semaphore = new Semaphore(maxConcurrency);

        List<CompletableFuture<SpawnResult>> futures = requests.stream()
                .map(request -> {
                    CompletableFuture<SpawnResult> future = CompletableFuture.supplyAsync(() -> {
                        try {
                            semaphore.acquire();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new CompletionException(e);
                        }
                        try {
                            return coordinator.spawn(request);
                        } finally {
                            semaphore.release();
                        }
                    }, executor);
                    return timeoutMs > 0 ? future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS) : future;
                })
                .toList();
        return allOf(futures);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Walkers still running after 5s; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static CompletableFuture<List<SpawnResult>> allOf(List<CompletableFuture<SpawnResult>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }
}
