package com.object.spatial.cdi;

import com.object.spatial.api.ObjectSpatialRuntime;
import com.object.spatial.api.RuntimeOptions;
import com.object.spatial.cache.CacheConfig;
import com.object.spatial.lock.LockConfig;
import com.object.spatial.tracing.NoOpTracingService;
import com.object.spatial.tracing.OpenTelemetryTracingService;
import com.object.spatial.tracing.TracingService;
import com.object.spatial.walker.ExitPolicy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the runtime from MicroProfile Config properties.
 *
 * <pre>
 * object-spatial:
 *   lock:
 *     timeout-ms: 5000
 *   walker:
 *     exit-policy: ONCE_PER_NODE
 *   flow:
 *     pool-size: 4
 *   tracing:
 *     enabled: false
 * </pre>
 *
 * <p>Inject the runtime directly: {@code @Inject ObjectSpatialRuntime runtime;}</p>
 */
@ApplicationScoped
public class ObjectSpatialProducer {

    private static final Logger log = LoggerFactory.getLogger(ObjectSpatialProducer.class);

    // ── Locking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "object-spatial.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "object-spatial.lock.fair", defaultValue = "false")
    boolean lockFair;

    // ── Walkers ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "object-spatial.walker.exit-policy", defaultValue = "ONCE_PER_NODE")
    String exitPolicy;

    @Inject
    @ConfigProperty(name = "object-spatial.async.timeout-ms", defaultValue = "0")
    long asyncTimeoutMs;

    // ── Flow tasks ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "object-spatial.flow.pool-size", defaultValue = "4")
    int flowPoolSize;

    @Inject
    @ConfigProperty(name = "object-spatial.flow.timeout-ms", defaultValue = "30000")
    long flowTimeoutMs;

    // ── Ability cache ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "object-spatial.ability-cache.enabled", defaultValue = "true")
    boolean abilityCacheEnabled;

    @Inject
    @ConfigProperty(name = "object-spatial.ability-cache.max-size", defaultValue = "1024")
    int abilityCacheMaxSize;

    // ── Tracing ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "object-spatial.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Produces
    @ApplicationScoped
    public ObjectSpatialRuntime objectSpatialRuntime() {
        log.info("Producing ObjectSpatialRuntime: exitPolicy={} flowPoolSize={} lockTimeoutMs={}",
                exitPolicy, flowPoolSize, lockTimeoutMs);

        RuntimeOptions options = RuntimeOptions.builder()
                .exitPolicy(parseExitPolicy(exitPolicy))
                .flowPoolSize(flowPoolSize)
                .flowTimeoutMs(flowTimeoutMs)
                .asyncTimeoutMs(asyncTimeoutMs)
                .build();

        return ObjectSpatialRuntime.builder()
                .lockConfig(new LockConfig(lockTimeoutMs, lockFair))
                .cacheConfig(new CacheConfig(abilityCacheMaxSize, abilityCacheEnabled))
                .options(options)
                .tracingService(tracingService())
                .build();
    }

    public void closeRuntime(@Disposes ObjectSpatialRuntime runtime) {
        log.info("Closing ObjectSpatialRuntime");
        runtime.close();
    }

    private TracingService tracingService() {
        // Uses whatever SDK the host registered globally; a no-op tracer otherwise
        return tracingEnabled ? OpenTelemetryTracingService.fromGlobal() : new NoOpTracingService();
    }

    private static ExitPolicy parseExitPolicy(String value) {
        try {
            return ExitPolicy.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown exit policy '" + value
                    + "'; expected ONCE_PER_NODE or ONCE_PER_VISIT", e);
        }
    }
}
