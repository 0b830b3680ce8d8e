package com.object.spatial.api;

import com.object.spatial.spawn.SpawnResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs spawns on background threads, one walker per task.
 * Each walker is still driven by a single thread from start to finish.
 */
public interface AsyncSpawner extends AutoCloseable {

    CompletableFuture<SpawnResult> spawnAsync(SpawnRequest request);

    /**
     * Runs all requests in parallel; results keep request order.
     */
    CompletableFuture<List<SpawnResult>> spawnAllAsync(List<SpawnRequest> requests);

    /**
     * Runs all requests with at most {@code maxConcurrency} walkers in flight.
     */
    CompletableFuture<List<SpawnResult>> spawnAllAsync(List<SpawnRequest> requests, int maxConcurrency);

    @Override
    void close();
}
