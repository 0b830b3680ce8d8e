package com.object.spatial.flow;

import com.object.spatial.error.FlowTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker pool behind {@code flow} and {@code await}.
 *
 * <p>Tasks parallelize work inside one ability invocation. They never touch the
 * launching walker's queue; the walker resumes its own traversal only after the
 * ability body returns.</p>
 */
public class FlowExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FlowExecutor.class);

    private final ExecutorService executor;
    private final long defaultTimeoutMs;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param poolSize         number of worker threads
     * @param defaultTimeoutMs timeout applied by {@link #await(FlowHandle)}; 0 waits indefinitely
     */
    public FlowExecutor(int poolSize, long defaultTimeoutMs) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must be >= 0");
        }
        this.executor = Executors.newFixedThreadPool(poolSize, new FlowThreadFactory());
        this.defaultTimeoutMs = defaultTimeoutMs;
        log.info("FlowExecutor initialized: poolSize={}, defaultTimeoutMs={}", poolSize, defaultTimeoutMs);
    }

    public <T> FlowHandle<T> launch(Callable<T> task) {
        Objects.requireNonNull(task, "task is required");
        long id = sequence.incrementAndGet();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
        log.debug("Launched flow task {}", id);
        return new FlowHandle<>(id, future);
    }

    /**
     * Joins a task with the default timeout.
     */
    public <T> T await(FlowHandle<T> handle) {
        return defaultTimeoutMs > 0 ? await(handle, Duration.ofMillis(defaultTimeoutMs)) : await(handle, null);
    }

    /**
     * Joins a task.
     *
     * @param timeout maximum wait; null waits indefinitely
     * @throws FlowTaskException if the task failed, timed out, or the wait was interrupted
     */
    public <T> T await(FlowHandle<T> handle, Duration timeout) {
        CompletableFuture<T> future = handle.toCompletableFuture();
        try {
            return timeout == null
                    ? future.get()
                    : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            throw new FlowTaskException("Flow task " + handle.getId() + " failed", cause);
        } catch (TimeoutException e) {
            throw new FlowTaskException("Flow task " + handle.getId() + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowTaskException("Interrupted while awaiting flow task " + handle.getId(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class FlowThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "osp-flow-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
