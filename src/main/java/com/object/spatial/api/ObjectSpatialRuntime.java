package com.object.spatial.api;

import com.object.spatial.ability.ElementAbilityRegistry;
import com.object.spatial.cache.CacheConfig;
import com.object.spatial.cache.CaffeineAbilityCache;
import com.object.spatial.cache.NoOpAbilityCache;
import com.object.spatial.core.model.AccessLevel;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Direction;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.EdgeDirection;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.FieldSpec;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.error.ConfigException;
import com.object.spatial.flow.FlowExecutor;
import com.object.spatial.graph.GraphStore;
import com.object.spatial.graph.InMemoryGraphStore;
import com.object.spatial.graph.Neighbor;
import com.object.spatial.graph.SweepResult;
import com.object.spatial.lock.LockConfig;
import com.object.spatial.logging.LogContext;
import com.object.spatial.metrics.MetricsService;
import com.object.spatial.metrics.NoOpMetricsService;
import com.object.spatial.persistence.NoOpPersistenceGateway;
import com.object.spatial.persistence.PersistenceGateway;
import com.object.spatial.spawn.LiveWalkerRegistry;
import com.object.spatial.spawn.SpawnCoordinator;
import com.object.spatial.spawn.SpawnResult;
import com.object.spatial.tracing.NoOpTracingService;
import com.object.spatial.tracing.Span;
import com.object.spatial.tracing.TracingService;
import com.object.spatial.visit.VisitResolver;
import com.object.spatial.walker.WalkerEngine;
import com.object.spatial.walker.WalkerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Main entry point: a graph store plus the machinery to spawn walkers on it.
 *
 * <pre>
 * ObjectSpatialRuntime runtime = ObjectSpatialRuntime.builder()
 *     .persistence(gateway)
 *     .options(RuntimeOptions.builder().global("threshold", 3).build())
 *     .build();
 *
 * Node root = runtime.root("tenant-a");
 * Node city = runtime.createNode(root.getId(), cityType, Map.of("name", "Lyon"));
 * runtime.connect(root.getId(), city.getId());
 *
 * WalkerType visitor = runtime.walkerType("Visitor")
 *     .onEntryAny(ctx -&gt; {
 *         ctx.visit(TraversalPath.outgoing());
 *         ctx.report(ctx.here().getAttribute("name"));
 *     })
 *     .build();
 *
 * runtime.elementAbilities().onEntry(cityType, ctx -&gt; ctx.report("welcome"));
 *
 * SpawnResult result = runtime.spawn(visitor, root.getId());
 * </pre>
 */
public class ObjectSpatialRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ObjectSpatialRuntime.class);

    private final GraphStore graphStore;
    private final RuntimeOptions options;
    private final CacheConfig cacheConfig;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final FlowExecutor flowExecutor;
    private final LiveWalkerRegistry liveWalkers;
    private final ElementAbilityRegistry elementAbilities;
    private final SpawnCoordinator spawnCoordinator;
    private final AsyncSpawner asyncSpawner;

    private ObjectSpatialRuntime(Builder builder) {
        this.options = builder.options;
        this.cacheConfig = builder.cacheConfig;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.graphStore = builder.graphStore != null
                ? builder.graphStore : new InMemoryGraphStore(builder.persistence, builder.lockConfig);

        this.flowExecutor = new FlowExecutor(options.getFlowPoolSize(), options.getFlowTimeoutMs());
        VisitResolver visitResolver = new VisitResolver(graphStore);
        this.elementAbilities = new ElementAbilityRegistry();
        WalkerEngine engine = new WalkerEngine(graphStore, visitResolver, flowExecutor, metricsService, options,
                elementAbilities);
        this.liveWalkers = new LiveWalkerRegistry();
        this.spawnCoordinator = new SpawnCoordinator(graphStore, visitResolver, engine,
                metricsService, tracingService, liveWalkers);
        this.asyncSpawner = new AsyncSpawnerImpl(spawnCoordinator, options.getAsyncTimeoutMs());

        log.info("ObjectSpatialRuntime initialized: exitPolicy={}, flowPoolSize={}, abilityCache={}",
                options.getExitPolicy(), options.getFlowPoolSize(), cacheConfig.enabled());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Graph ==========

    /**
     * Gets, loads or creates the root for a tenant/session key.
     */
    public Node root(String rootKey) {
        return graphStore.root(rootKey);
    }

    public Node createNode(NodeId root, Archetype type) {
        return createNode(root, type, Map.of());
    }

    /**
     * Instantiates a node archetype in a root's partition. Declared fields must be
     * supplied unless they have a default; undeclared attributes are kept as-is.
     *
     * @throws ConfigException if a required field is missing
     */
    public Node createNode(NodeId root, Archetype type, Map<String, Object> attributes) {
        return graphStore.createNode(root, type, instantiate(type, attributes));
    }

    /**
     * Connects two nodes with a directed {@link Archetype#GENERIC_EDGE}.
     */
    public Edge connect(NodeId source, NodeId target) {
        return graphStore.createEdge(null, source, target, Map.of(), EdgeDirection.DIRECTED);
    }

    public Edge connect(NodeId source, NodeId target, Archetype edgeType,
                        Map<String, Object> attributes, EdgeDirection direction) {
        Map<String, Object> values = edgeType != null ? instantiate(edgeType, attributes) : attributes;
        return graphStore.createEdge(edgeType, source, target, values, direction);
    }

    public int disconnect(NodeId source, NodeId target) {
        return graphStore.disconnect(source, target, Direction.OUT, null);
    }

    public int disconnect(NodeId source, NodeId target, Direction direction, Predicate<Edge> edgeFilter) {
        return graphStore.disconnect(source, target, direction, edgeFilter);
    }

    public GraphElement get(ElementId id) {
        return graphStore.get(id);
    }

    public GraphElement updateAttributes(ElementId id, Map<String, Object> attributes) {
        return graphStore.updateAttributes(id, attributes);
    }

    public List<Neighbor> neighbors(NodeId node, Direction direction) {
        return graphStore.neighbors(node, direction, null);
    }

    public void delete(ElementId id) {
        graphStore.delete(id);
    }

    public void grant(NodeId targetRoot, NodeId grantee, AccessLevel level) {
        graphStore.grant(targetRoot, grantee, level);
    }

    public void revoke(NodeId targetRoot, NodeId grantee) {
        graphStore.revoke(targetRoot, grantee);
    }

    // ========== Walkers ==========

    /**
     * Starts a walker declaration whose ability resolution uses this runtime's cache settings.
     */
    public WalkerType.Builder walkerType(String name) {
        return WalkerType.builder(name)
                .abilityCache(cacheConfig.enabled()
                        ? new CaffeineAbilityCache(cacheConfig)
                        : new NoOpAbilityCache());
    }

    /**
     * Abilities declared on node and edge archetypes; they fire for every walker run by
     * this runtime, or for walkers of one type.
     */
    public ElementAbilityRegistry elementAbilities() {
        return elementAbilities;
    }

    public SpawnResult spawn(WalkerType walkerType, ElementId target) {
        return spawnCoordinator.spawn(SpawnRequest.of(walkerType, target));
    }

    public SpawnResult spawn(WalkerType walkerType, List<? extends ElementId> targets, Map<String, Object> fields) {
        return spawnCoordinator.spawn(walkerType, targets, fields);
    }

    public SpawnResult spawn(SpawnRequest request) {
        return spawnCoordinator.spawn(request);
    }

    public CompletableFuture<SpawnResult> spawnAsync(SpawnRequest request) {
        return asyncSpawner.spawnAsync(request);
    }

    public AsyncSpawner async() {
        return asyncSpawner;
    }

    // ========== Reclamation ==========

    /**
     * Sweeps every partition, keeping elements referenced by running walkers.
     */
    public List<SweepResult> sweep() {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logContext = LogContext.forSweep(correlationId);
             Span span = tracingService.startSpan("graph.sweep", Map.of("correlationId", correlationId))) {
            List<SweepResult> results = new ArrayList<>(graphStore.sweepAll(liveWalkers.liveReferences()));
            int reclaimed = results.stream().mapToInt(SweepResult::totalReclaimed).sum();
            metricsService.recordReclaimed(reclaimed);
            span.attribute("reclaimed", reclaimed);
            span.complete();
            log.info("sweep.completed partitions={} reclaimed={}", results.size(), reclaimed);
            return results;
        }
    }

    public SweepResult sweep(NodeId root) {
        SweepResult result = graphStore.sweep(root, liveWalkers.liveReferences());
        metricsService.recordReclaimed(result.totalReclaimed());
        return result;
    }

    /**
     * Deletes everything in a root's partition except the root.
     */
    public int resetRoot(NodeId root) {
        return graphStore.resetRoot(root);
    }

    // ========== Accessors ==========

    public GraphStore getGraphStore() {
        return graphStore;
    }

    public RuntimeOptions getOptions() {
        return options;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    public LiveWalkerRegistry getLiveWalkers() {
        return liveWalkers;
    }

    @Override
    public void close() {
        log.info("Closing ObjectSpatialRuntime");
        asyncSpawner.close();
        flowExecutor.close();
    }

    /**
     * Applies an archetype's declared fields to supplied values: required ones must be
     * present, missing optional ones take their default.
     */
    private static Map<String, Object> instantiate(Archetype type, Map<String, Object> supplied) {
        Map<String, Object> values = new LinkedHashMap<>(supplied != null ? supplied : Map.of());
        for (FieldSpec field : type.getFields().values()) {
            if (values.containsKey(field.name())) {
                continue;
            }
            if (field.required()) {
                throw new ConfigException("Missing required field '" + field.name() + "' for " + type.getName());
            }
            if (field.defaultValue() != null) {
                values.put(field.name(), field.defaultValue());
            }
        }
        return values;
    }

    public static class Builder {
        private GraphStore graphStore;
        private PersistenceGateway persistence = new NoOpPersistenceGateway();
        private LockConfig lockConfig = LockConfig.defaults();
        private RuntimeOptions options = RuntimeOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;

        private Builder() {
        }

        /**
         * Uses an existing graph store; {@link #persistence} and {@link #lockConfig} are then ignored.
         */
        public Builder graphStore(GraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        public Builder persistence(PersistenceGateway persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder options(RuntimeOptions options) {
            this.options = options;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public ObjectSpatialRuntime build() {
            if (persistence == null) {
                throw new IllegalStateException("persistence gateway is required");
            }
            return new ObjectSpatialRuntime(this);
        }
    }
}
