package com.object.spatial.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for one walker run or sweep.
 *
 * <p>Closing the context puts back whatever the keys held before it was opened, so a
 * walker spawned from inside another walker's ability leaves the outer run's
 * {@code walkerId} in place.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSpawn(walkerId, "Collector", rootId)) {
 *     log.info("walker.completed path={} reports={}", pathLength, reportCount);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String WALKER_ID = "walkerId";
    public static final String WALKER_TYPE = "walkerType";
    public static final String ROOT_ID = "rootId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";

    // key -> value before this context; null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forSpawn(String walkerId, String walkerType, String rootId) {
        return new LogContext()
                .with(OPERATION, "spawn")
                .with(WALKER_ID, walkerId)
                .with(WALKER_TYPE, walkerType)
                .with(ROOT_ID, rootId);
    }

    public static LogContext forSweep(String correlationId) {
        return new LogContext()
                .with(OPERATION, "sweep")
                .with(CORRELATION_ID, correlationId);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Sets one more MDC entry for the lifetime of this context.
     */
    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
