package com.object.spatial.flow;

import com.object.spatial.error.FlowTaskException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FlowExecutorTest {

    private FlowExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new FlowExecutor(2, 5_000);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Should return the task result")
    void testAwaitResult() {
        FlowHandle<String> handle = executor.launch(() -> "done");
        assertEquals("done", executor.await(handle));
        assertTrue(handle.isDone());
    }

    @Test
    @DisplayName("Should run tasks off the calling thread")
    void testRunsOnPool() {
        FlowHandle<String> handle = executor.launch(() -> Thread.currentThread().getName());
        assertTrue(executor.await(handle).startsWith("osp-flow-"));
    }

    @Test
    @DisplayName("Should assign increasing handle ids")
    void testHandleIds() {
        FlowHandle<Integer> first = executor.launch(() -> 1);
        FlowHandle<Integer> second = executor.launch(() -> 2);
        assertTrue(second.getId() > first.getId());
    }

    @Test
    @DisplayName("Should surface unchecked task failures with their cause")
    void testUncheckedFailure() {
        FlowHandle<Object> handle = executor.launch(() -> {
            throw new IllegalStateException("bad task");
        });

        FlowTaskException e = assertThrows(FlowTaskException.class, () -> executor.await(handle));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    @DisplayName("Should surface checked task failures with their cause")
    void testCheckedFailure() {
        FlowHandle<Object> handle = executor.launch(() -> {
            throw new IOException("io");
        });

        FlowTaskException e = assertThrows(FlowTaskException.class, () -> executor.await(handle));
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    @DisplayName("Should time out slow tasks")
    void testTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        FlowHandle<Boolean> handle = executor.launch(() -> release.await(5, TimeUnit.SECONDS));
        try {
            FlowTaskException e = assertThrows(FlowTaskException.class,
                    () -> executor.await(handle, Duration.ofMillis(50)));
            assertTrue(e.getCause() instanceof TimeoutException);
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Should reject invalid pool settings")
    void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new FlowExecutor(0, 100));
        assertThrows(IllegalArgumentException.class, () -> new FlowExecutor(1, -1));
    }
}
