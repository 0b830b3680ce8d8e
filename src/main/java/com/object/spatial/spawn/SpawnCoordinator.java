package com.object.spatial.spawn;

import com.object.spatial.api.SpawnRequest;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.FieldSpec;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.error.ConfigException;
import com.object.spatial.error.WalkerExecutionException;
import com.object.spatial.graph.GraphStore;
import com.object.spatial.logging.LogContext;
import com.object.spatial.metrics.MetricsService;
import com.object.spatial.tracing.Span;
import com.object.spatial.tracing.TracingService;
import com.object.spatial.visit.VisitResolver;
import com.object.spatial.walker.Walker;
import com.object.spatial.walker.WalkerEngine;
import com.object.spatial.walker.WalkerOutcome;
import com.object.spatial.walker.WalkerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Validates spawn requests, allocates an isolated walker per call and drives it
 * through the {@link WalkerEngine}.
 */
public class SpawnCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SpawnCoordinator.class);

    private final GraphStore graphStore;
    private final VisitResolver visitResolver;
    private final WalkerEngine engine;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final LiveWalkerRegistry liveWalkers;

    public SpawnCoordinator(GraphStore graphStore, VisitResolver visitResolver, WalkerEngine engine,
                            MetricsService metrics, TracingService tracing, LiveWalkerRegistry liveWalkers) {
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore is required");
        this.visitResolver = Objects.requireNonNull(visitResolver, "visitResolver is required");
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracing = Objects.requireNonNull(tracing, "tracing is required");
        this.liveWalkers = Objects.requireNonNull(liveWalkers, "liveWalkers is required");
    }

    public SpawnResult spawn(WalkerType walkerType, List<? extends ElementId> targets, Map<String, Object> fields) {
        return spawn(SpawnRequest.of(walkerType, targets, fields));
    }

    /**
     * Runs one walker to completion on the calling thread.
     *
     * @throws ConfigException          if targets are empty or fields do not match the walker type
     * @throws com.object.spatial.error.NotFoundException if a target does not exist
     * @throws WalkerExecutionException if an ability fails; carries the reports gathered before the failure
     */
    public SpawnResult spawn(SpawnRequest request) {
        WalkerType walkerType = request.walkerType();
        if (request.targets().isEmpty()) {
            throw new ConfigException("Spawn of " + walkerType.getName() + " needs at least one target");
        }
        GraphElement first = graphStore.get(request.targets().get(0));
        for (ElementId target : request.targets()) {
            graphStore.get(target);
        }
        Map<String, Object> fields = resolveFields(walkerType, request.fields());
        NodeId actingRoot = request.actingRoot() != null ? request.actingRoot() : first.getRootId();
        List<ElementId> seeds = visitResolver.expand(request.targets());

        Walker walker = new Walker(UUID.randomUUID().toString(), walkerType, actingRoot, fields);
        liveWalkers.register(walker);
        long start = System.nanoTime();
        try (LogContext logContext = LogContext.forSpawn(walker.getId(), walkerType.getName(), actingRoot.toString());
             Span span = tracing.startSpan("walker.spawn",
                     Map.of("walkerType", walkerType.getName(), "walkerId", walker.getId()))) {
            try {
                WalkerOutcome outcome = engine.run(walker, seeds);
                SpawnResult result = new SpawnResult(walker.getId(), walker.getReports(), walker.getPath(), outcome);
                span.attribute("path.length", result.path().size());
                span.attribute("reports", result.reports().size());
                if (result.isDisengaged()) {
                    span.event("walker.disengaged");
                    metrics.incrementDisengaged(walkerType.getName());
                }
                span.complete();
                record(walkerType, outcome, start, result.path().size(), result.reports().size());
                log.debug("walker.completed outcome={} path={} reports={}",
                        outcome, result.path().size(), result.reports().size());
                return result;
            } catch (WalkerExecutionException e) {
                span.fail(e.getCause() != null ? e.getCause() : e);
                record(walkerType, WalkerOutcome.FAILED, start, e.getPath().size(), e.getReports().size());
                log.warn("Walker {} ({}) failed after {} steps: {}",
                        walker.getId(), walkerType.getName(), e.getPath().size(), e.getMessage());
                throw e;
            }
        } finally {
            liveWalkers.unregister(walker);
        }
    }

    public LiveWalkerRegistry getLiveWalkers() {
        return liveWalkers;
    }

    /**
     * Checks supplied values against the declared fields and applies defaults.
     */
    static Map<String, Object> resolveFields(WalkerType walkerType, Map<String, Object> supplied) {
        Map<String, FieldSpec> declared = walkerType.getFields();
        for (String name : supplied.keySet()) {
            if (!declared.containsKey(name)) {
                throw new ConfigException(walkerType.getName() + " has no field '" + name + "'");
            }
        }
        Map<String, Object> resolved = new HashMap<>();
        for (FieldSpec field : declared.values()) {
            if (supplied.containsKey(field.name())) {
                resolved.put(field.name(), supplied.get(field.name()));
            } else if (field.required()) {
                throw new ConfigException("Missing required field '" + field.name()
                        + "' for walker " + walkerType.getName());
            } else {
                resolved.put(field.name(), field.defaultValue());
            }
        }
        return resolved;
    }

    private void record(WalkerType walkerType, WalkerOutcome outcome, long startNanos, int pathLength, int reports) {
        metrics.recordSpawnDuration(walkerType.getName(), outcome, Duration.ofNanos(System.nanoTime() - startNanos));
        metrics.recordPathLength(pathLength);
        metrics.recordReportCount(reports);
    }
}
