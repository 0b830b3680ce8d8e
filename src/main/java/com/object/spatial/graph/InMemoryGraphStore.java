package com.object.spatial.graph;

import com.object.spatial.core.model.AccessLevel;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.ArchetypeKind;
import com.object.spatial.core.model.Direction;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.EdgeDirection;
import com.object.spatial.core.model.EdgeId;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.error.AccessDeniedException;
import com.object.spatial.error.NotFoundException;
import com.object.spatial.error.TypeMismatchException;
import com.object.spatial.lock.LockConfig;
import com.object.spatial.lock.PartitionLocks;
import com.object.spatial.persistence.NoOpPersistenceGateway;
import com.object.spatial.persistence.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory {@link GraphStore}.
 *
 * <p>Nodes and edges are kept in arena-style maps keyed by ids drawn from blocks the
 * persistence collaborator reserves, so ids are never reused, even by another store
 * on the same backend, and within one store id order is creation order. Adjacency
 * lists are copy-on-write, which keeps reads lock-free; every mutation runs under the
 * write lock of each root partition it touches.</p>
 *
 * <p>Persistence collaborator calls are made while those locks are still held, so the
 * saves and removals of one element reach the collaborator in mutation order.</p>
 */
public class InMemoryGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    static final int ID_BLOCK_SIZE = 64;

    private final Object idLock = new Object();
    private long nextId;
    private long idBlockEnd;
    private final Map<NodeId, NodeSlot> nodes = new ConcurrentHashMap<>();
    private final Map<EdgeId, EdgeSlot> edges = new ConcurrentHashMap<>();
    private final Map<NodeId, Partition> partitions = new ConcurrentHashMap<>();
    private final Map<String, NodeId> rootsByKey = new ConcurrentHashMap<>();
    private final List<NodeId> rootOrder = new CopyOnWriteArrayList<>();
    private final PartitionLocks locks;
    private final PersistenceGateway persistence;

    public InMemoryGraphStore() {
        this(new NoOpPersistenceGateway(), LockConfig.defaults());
    }

    public InMemoryGraphStore(PersistenceGateway persistence) {
        this(persistence, LockConfig.defaults());
    }

    public InMemoryGraphStore(PersistenceGateway persistence, LockConfig lockConfig) {
        this.persistence = persistence;
        this.locks = new PartitionLocks(lockConfig);
    }

    // ========== Roots ==========

    @Override
    public Node root(String rootKey) {
        if (rootKey == null || rootKey.isBlank()) {
            throw new IllegalArgumentException("rootKey must not be null or blank");
        }
        NodeId id = rootsByKey.computeIfAbsent(rootKey, this::loadOrCreateRoot);
        return getNode(id);
    }

    @Override
    public List<NodeId> roots() {
        return List.copyOf(rootOrder);
    }

    private NodeId loadOrCreateRoot(String rootKey) {
        Optional<Node> loaded = persistence.loadRoot(rootKey);
        NodeSlot slot;
        if (loaded.isPresent()) {
            Node saved = loaded.get();
            if (nodes.containsKey(saved.getId())) {
                throw new IllegalStateException("Loaded root " + saved.getId() + " collides with a live node");
            }
            slot = new NodeSlot(saved.getId(), saved.getType(), saved.getId());
            slot.attributes.putAll(saved.getAttributes());
            log.info("Loaded root {} for key {}", slot.id, rootKey);
        } else {
            NodeId id = new NodeId(issueId());
            slot = new NodeSlot(id, Archetype.ROOT, id);
            log.info("Created root {} for key {}", slot.id, rootKey);
        }
        slot.persistent = true;
        nodes.put(slot.id, slot);
        Partition partition = new Partition(slot.id, rootKey);
        partition.members.add(slot.id);
        partitions.put(slot.id, partition);
        rootOrder.add(slot.id);
        if (loaded.isEmpty()) {
            persistence.registerRoot(rootKey, slot.snapshot());
        }
        return slot.id;
    }

    // ========== Creation ==========

    @Override
    public Node createNode(NodeId root, Archetype type, Map<String, Object> attributes) {
        requireKind(type, ArchetypeKind.NODE);
        validateAttributes(attributes);
        Partition partition = partition(root);

        Node created = locks.write(root, () -> {
            NodeSlot slot = new NodeSlot(new NodeId(issueId()), type, root);
            if (attributes != null) {
                slot.attributes.putAll(attributes);
            }
            nodes.put(slot.id, slot);
            partition.members.add(slot.id);
            return slot.snapshot();
        });
        log.debug("Created node {} in partition {}", created, root);
        return created;
    }

    @Override
    public Edge createEdge(Archetype type, NodeId source, NodeId target,
                           Map<String, Object> attributes, EdgeDirection direction) {
        Archetype edgeType = type != null ? type : Archetype.GENERIC_EDGE;
        EdgeDirection edgeDirection = direction != null ? direction : EdgeDirection.DIRECTED;
        requireKind(edgeType, ArchetypeKind.EDGE);
        validateAttributes(attributes);

        NodeSlot src = nodeSlot(source);
        NodeSlot dst = nodeSlot(target);
        if (!edgeType.allowsEndpoints(src.type, dst.type)) {
            throw new TypeMismatchException(
                    "Edge type " + edgeType + " cannot connect " + src.type + " to " + dst.type);
        }
        if (!src.root.equals(dst.root) && !accessLevel(src.root, dst.root).allows(AccessLevel.CONNECT)) {
            throw new AccessDeniedException(src.root, dst.root, AccessLevel.CONNECT);
        }

        List<GraphElement> toSave = new ArrayList<>();
        Edge created = locks.write(partitionSet(src.root, dst.root), () -> {
            requireLive(src);
            requireLive(dst);
            EdgeSlot slot = new EdgeSlot(new EdgeId(issueId()), edgeType, src.root,
                    source, target, edgeDirection);
            if (attributes != null) {
                slot.attributes.putAll(attributes);
            }
            edges.put(slot.id, slot);
            src.outgoing.add(slot.id);
            dst.incoming.add(slot.id);

            boolean srcDurable = src.persistent;
            boolean dstDurable = dst.persistent;
            if (srcDurable || (edgeDirection == EdgeDirection.UNDIRECTED && dstDurable)) {
                slot.persistent = true;
                toSave.add(slot.snapshot());
                markReachable(srcDurable ? dst : src, partitionSet(src.root, dst.root), toSave);
            }
            if (srcDurable) {
                toSave.add(src.snapshot());
            }
            if (dstDurable) {
                toSave.add(dst.snapshot());
            }
            toSave.forEach(persistence::save);
            return slot.snapshot();
        });
        log.debug("Created edge {}", created);
        return created;
    }

    // ========== Lookup ==========

    @Override
    public GraphElement get(ElementId id) {
        if (id instanceof NodeId nodeId) {
            return getNode(nodeId);
        }
        return getEdge((EdgeId) id);
    }

    @Override
    public Node getNode(NodeId id) {
        return nodeSlot(id).snapshot();
    }

    @Override
    public Edge getEdge(EdgeId id) {
        return edgeSlot(id).snapshot();
    }

    @Override
    public Optional<GraphElement> find(ElementId id) {
        if (id instanceof NodeId nodeId) {
            NodeSlot slot = nodes.get(nodeId);
            return slot != null ? Optional.of(slot.snapshot()) : Optional.empty();
        }
        EdgeSlot slot = edges.get((EdgeId) id);
        return slot != null ? Optional.of(slot.snapshot()) : Optional.empty();
    }

    @Override
    public boolean exists(ElementId id) {
        return id instanceof NodeId nodeId ? nodes.containsKey(nodeId) : edges.containsKey((EdgeId) id);
    }

    @Override
    public GraphElement updateAttributes(ElementId id, Map<String, Object> attributes) {
        validateAttributes(attributes);
        GraphElement updated;
        if (id instanceof NodeId nodeId) {
            NodeSlot slot = nodeSlot(nodeId);
            updated = locks.write(slot.root, () -> {
                requireLive(slot);
                slot.attributes.putAll(attributes);
                return saveIfPersistent(slot.snapshot());
            });
        } else {
            EdgeSlot slot = edgeSlot((EdgeId) id);
            updated = locks.write(slot.root, () -> {
                if (edges.get(slot.id) != slot) {
                    throw new NotFoundException(slot.id);
                }
                slot.attributes.putAll(attributes);
                return saveIfPersistent(slot.snapshot());
            });
        }
        return updated;
    }

    @Override
    public List<Neighbor> neighbors(NodeId node, Direction direction, Predicate<Edge> edgeFilter) {
        NodeSlot slot = nodeSlot(node);
        return locks.read(slot.root, () -> incidentEdgeIds(slot, direction).stream()
                .map(edgeId -> toNeighbor(slot.id, edgeId))
                .flatMap(Optional::stream)
                .filter(n -> edgeFilter == null || edgeFilter.test(n.edge()))
                .collect(Collectors.toList()));
    }

    @Override
    public Stream<Neighbor> neighborStream(NodeId node, Direction direction) {
        NodeSlot slot = nodeSlot(node);
        List<EdgeId> captured = locks.read(slot.root, () -> new ArrayList<>(incidentEdgeIds(slot, direction)));
        return captured.stream()
                .map(edgeId -> toNeighbor(slot.id, edgeId))
                .flatMap(Optional::stream);
    }

    // ========== Deletion ==========

    @Override
    public int disconnect(NodeId source, NodeId target, Direction direction, Predicate<Edge> edgeFilter) {
        List<EdgeId> matching = neighbors(source, direction, edgeFilter).stream()
                .filter(n -> n.node().getId().equals(target))
                .map(n -> n.edge().getId())
                .distinct()
                .toList();
        int removed = 0;
        for (EdgeId edgeId : matching) {
            if (edges.containsKey(edgeId)) {
                delete(edgeId);
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void delete(ElementId id) {
        Deletion deletion = new Deletion();
        if (id instanceof NodeId nodeId) {
            NodeSlot slot = nodeSlot(nodeId);
            if (slot.isRoot()) {
                throw new IllegalArgumentException("Root " + nodeId + " cannot be deleted; use resetRoot");
            }
            withPartitions(() -> partitionsTouching(List.of(slot)), () -> {
                requireLive(slot);
                removeNode(slot, deletion);
                deletion.flush();
                return null;
            });
        } else {
            EdgeSlot slot = edgeSlot((EdgeId) id);
            withPartitions(() -> partitionsTouching(slot), () -> {
                if (edges.get(slot.id) != slot) {
                    throw new NotFoundException(slot.id);
                }
                removeEdge(slot, deletion);
                deletion.flush();
                return null;
            });
        }
        log.debug("Deleted {} ({} elements)", id, deletion.count);
    }

    // ========== Access ==========

    @Override
    public void grant(NodeId targetRoot, NodeId grantee, AccessLevel level) {
        Partition partition = partition(targetRoot);
        partition(grantee);
        if (level == AccessLevel.NO_ACCESS) {
            partition.grants.remove(grantee);
        } else {
            partition.grants.put(grantee, level);
        }
        log.info("Root {} granted {} on partition {}", grantee, level, targetRoot);
    }

    @Override
    public void revoke(NodeId targetRoot, NodeId grantee) {
        if (partition(targetRoot).grants.remove(grantee) != null) {
            log.info("Root {} revoked from partition {}", grantee, targetRoot);
        }
    }

    @Override
    public AccessLevel accessLevel(NodeId actingRoot, NodeId targetRoot) {
        if (actingRoot.equals(targetRoot)) {
            return AccessLevel.WRITE;
        }
        return partition(targetRoot).grants.getOrDefault(actingRoot, AccessLevel.NO_ACCESS);
    }

    // ========== Reclamation ==========

    @Override
    public SweepResult sweep(NodeId root, Set<ElementId> liveReferences) {
        Partition partition = partition(root);
        Set<ElementId> live = liveReferences != null ? liveReferences : Set.of();
        Deletion deletion = new Deletion();
        List<GraphElement> promoted = new ArrayList<>();

        SweepResult result = withPartitions(() -> partitionsTouching(memberSlots(partition)), () -> {
            Set<NodeId> durable = closure(partition, durableSeeds(partition));
            Set<NodeId> retained = closure(partition, retentionSeeds(partition, live, durable));

            int nodesBefore = deletion.nodes;
            int edgesBefore = deletion.edges;
            for (NodeSlot slot : memberSlots(partition)) {
                if (!retained.contains(slot.id)) {
                    removeNode(slot, deletion);
                }
            }
            for (NodeSlot slot : memberSlots(partition)) {
                boolean shouldPersist = durable.contains(slot.id);
                if (shouldPersist && !slot.persistent) {
                    slot.persistent = true;
                    promoted.add(slot.snapshot());
                } else if (!shouldPersist && slot.persistent) {
                    slot.persistent = false;
                    deletion.unsaved.add(slot.id);
                }
                for (EdgeId edgeId : slot.outgoing) {
                    EdgeSlot edge = edges.get(edgeId);
                    if (edge != null) {
                        edge.persistent = shouldPersist
                                || (edge.isUndirected() && isPersistent(edge.target));
                    }
                }
            }
            deletion.flush();
            promoted.forEach(persistence::save);
            return new SweepResult(root, deletion.nodes - nodesBefore, deletion.edges - edgesBefore,
                    partition.members.size());
        });
        if (result.totalReclaimed() > 0) {
            log.info("Sweep of partition {} reclaimed {} nodes and {} edges",
                    root, result.nodesReclaimed(), result.edgesReclaimed());
        }
        return result;
    }

    @Override
    public Collection<SweepResult> sweepAll(Set<ElementId> liveReferences) {
        List<SweepResult> results = new ArrayList<>();
        for (NodeId root : rootOrder) {
            results.add(sweep(root, liveReferences));
        }
        return results;
    }

    @Override
    public int resetRoot(NodeId root) {
        Partition partition = partition(root);
        NodeSlot rootSlot = nodeSlot(root);
        Deletion deletion = new Deletion();
        withPartitions(() -> partitionsTouching(memberSlots(partition)), () -> {
            for (NodeSlot slot : memberSlots(partition)) {
                if (!slot.isRoot()) {
                    removeNode(slot, deletion);
                }
            }
            for (EdgeId edgeId : List.copyOf(rootSlot.outgoing)) {
                EdgeSlot edge = edges.get(edgeId);
                if (edge != null) {
                    removeEdge(edge, deletion);
                }
            }
            deletion.flush();
            persistence.save(rootSlot.snapshot());
            return null;
        });
        log.info("Reset partition {}: {} elements deleted", root, deletion.count);
        return deletion.count;
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public int edgeCount() {
        return edges.size();
    }

    // ========== Internals ==========

    private long issueId() {
        synchronized (idLock) {
            if (nextId >= idBlockEnd) {
                nextId = persistence.reserveIds(ID_BLOCK_SIZE);
                idBlockEnd = nextId + ID_BLOCK_SIZE;
            }
            return nextId++;
        }
    }

    private Partition partition(NodeId root) {
        Partition partition = partitions.get(root);
        if (partition == null) {
            if (nodes.containsKey(root)) {
                throw new IllegalArgumentException(root + " is not a root");
            }
            throw new NotFoundException(root);
        }
        return partition;
    }

    private NodeSlot nodeSlot(NodeId id) {
        NodeSlot slot = nodes.get(id);
        if (slot == null) {
            throw new NotFoundException(id);
        }
        return slot;
    }

    private EdgeSlot edgeSlot(EdgeId id) {
        EdgeSlot slot = edges.get(id);
        if (slot == null) {
            throw new NotFoundException(id);
        }
        return slot;
    }

    private void requireLive(NodeSlot slot) {
        if (nodes.get(slot.id) != slot) {
            throw new NotFoundException(slot.id);
        }
    }

    private GraphElement saveIfPersistent(GraphElement snapshot) {
        if (snapshot.isPersistent()) {
            persistence.save(snapshot);
        }
        return snapshot;
    }

    private boolean isPersistent(NodeId id) {
        NodeSlot slot = nodes.get(id);
        return slot != null && slot.persistent;
    }

    private static void requireKind(Archetype type, ArchetypeKind kind) {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (type.getKind() != kind) {
            throw new TypeMismatchException("Expected a " + kind + " archetype but got " + type
                    + " (" + type.getKind() + ")");
        }
    }

    private static void validateAttributes(Map<String, Object> attributes) {
        if (attributes == null) {
            return;
        }
        attributes.forEach((key, value) -> {
            if (key == null || value == null) {
                throw new IllegalArgumentException("attribute names and values must not be null: " + key);
            }
        });
    }

    private static Set<NodeId> partitionSet(NodeId... roots) {
        return new LinkedHashSet<>(List.of(roots));
    }

    /**
     * Runs {@code action} under the write locks of the partitions {@code required} names.
     * The set is recomputed once the locks are held and the attempt is retried if
     * a concurrent connect widened it.
     */
    private <T> T withPartitions(Supplier<Set<NodeId>> required, Supplier<T> action) {
        while (true) {
            Set<NodeId> wanted = required.get();
            AtomicReference<T> result = new AtomicReference<>();
            boolean completed = locks.write(wanted, () -> {
                if (!wanted.containsAll(required.get())) {
                    return false;
                }
                result.set(action.get());
                return true;
            });
            if (completed) {
                return result.get();
            }
            log.debug("Partition set changed while locking {}; retrying", wanted);
        }
    }

    private Set<NodeId> partitionsTouching(Collection<NodeSlot> slots) {
        Set<NodeId> roots = new HashSet<>();
        for (NodeSlot slot : slots) {
            roots.add(slot.root);
            for (EdgeId edgeId : slot.incidentEdges()) {
                EdgeSlot edge = edges.get(edgeId);
                if (edge != null) {
                    NodeSlot other = nodes.get(edge.opposite(slot.id));
                    if (other != null) {
                        roots.add(other.root);
                    }
                }
            }
        }
        return roots;
    }

    private Set<NodeId> partitionsTouching(EdgeSlot edge) {
        Set<NodeId> roots = new HashSet<>();
        roots.add(edge.root);
        NodeSlot target = nodes.get(edge.target);
        if (target != null) {
            roots.add(target.root);
        }
        return roots;
    }

    private List<NodeSlot> memberSlots(Partition partition) {
        List<NodeSlot> slots = new ArrayList<>();
        for (NodeId id : new TreeSet<>(partition.members)) {
            NodeSlot slot = nodes.get(id);
            if (slot != null) {
                slots.add(slot);
            }
        }
        return slots;
    }

    private Set<EdgeId> incidentEdgeIds(NodeSlot slot, Direction direction) {
        Set<EdgeId> ids = new TreeSet<>();
        if (direction.includesOutgoing()) {
            ids.addAll(slot.outgoing);
            addUndirected(slot.incoming, ids);
        }
        if (direction.includesIncoming()) {
            ids.addAll(slot.incoming);
            addUndirected(slot.outgoing, ids);
        }
        return ids;
    }

    private void addUndirected(List<EdgeId> candidates, Set<EdgeId> into) {
        for (EdgeId edgeId : candidates) {
            EdgeSlot edge = edges.get(edgeId);
            if (edge != null && edge.isUndirected()) {
                into.add(edgeId);
            }
        }
    }

    private Optional<Neighbor> toNeighbor(NodeId origin, EdgeId edgeId) {
        EdgeSlot edge = edges.get(edgeId);
        if (edge == null) {
            return Optional.empty();
        }
        NodeSlot other = nodes.get(edge.opposite(origin));
        if (other == null) {
            return Optional.empty();
        }
        return Optional.of(new Neighbor(edge.snapshot(), other.snapshot()));
    }

    /**
     * Marks {@code start} and everything it reaches inside the locked partitions as persistent.
     */
    private void markReachable(NodeSlot start, Set<NodeId> locked, List<GraphElement> toSave) {
        Deque<NodeSlot> work = new ArrayDeque<>();
        if (!start.persistent) {
            start.persistent = true;
            toSave.add(start.snapshot());
            work.add(start);
        }
        while (!work.isEmpty()) {
            NodeSlot current = work.poll();
            for (EdgeId edgeId : traversableEdges(current)) {
                EdgeSlot edge = edges.get(edgeId);
                NodeSlot next = edge != null ? nodes.get(edge.opposite(current.id)) : null;
                if (next == null) {
                    continue;
                }
                if (!edge.persistent) {
                    edge.persistent = true;
                    toSave.add(edge.snapshot());
                }
                if (!next.persistent && locked.contains(next.root)) {
                    next.persistent = true;
                    toSave.add(next.snapshot());
                    work.add(next);
                }
            }
        }
    }

    /**
     * Edges along which reachability flows from {@code slot}: outgoing ones, plus
     * incoming undirected ones.
     */
    private List<EdgeId> traversableEdges(NodeSlot slot) {
        List<EdgeId> ids = new ArrayList<>(slot.outgoing);
        for (EdgeId edgeId : slot.incoming) {
            EdgeSlot edge = edges.get(edgeId);
            if (edge != null && edge.isUndirected()) {
                ids.add(edgeId);
            }
        }
        return ids;
    }

    private Set<NodeId> durableSeeds(Partition partition) {
        Set<NodeId> seeds = new HashSet<>();
        seeds.add(partition.root);
        for (NodeSlot slot : memberSlots(partition)) {
            for (EdgeId edgeId : slot.incoming) {
                EdgeSlot edge = edges.get(edgeId);
                if (edge != null && !edge.root.equals(partition.root) && isPersistent(edge.source)) {
                    seeds.add(slot.id);
                }
            }
        }
        return seeds;
    }

    private Set<NodeId> retentionSeeds(Partition partition, Set<ElementId> live, Set<NodeId> durable) {
        Set<NodeId> seeds = new HashSet<>(durable);
        for (NodeSlot slot : memberSlots(partition)) {
            if (live.contains(slot.id)) {
                seeds.add(slot.id);
            }
            for (EdgeId edgeId : slot.incidentEdges()) {
                EdgeSlot edge = edges.get(edgeId);
                if (edge == null) {
                    continue;
                }
                NodeSlot other = nodes.get(edge.opposite(slot.id));
                // Nodes referenced from another partition are kept for that partition's sweep to decide
                if (other != null && !other.root.equals(partition.root) && edge.target.equals(slot.id)) {
                    seeds.add(slot.id);
                }
                if (live.contains(edgeId)) {
                    seeds.add(edge.source);
                    seeds.add(edge.target);
                }
            }
        }
        seeds.retainAll(partition.members);
        return seeds;
    }

    private Set<NodeId> closure(Partition partition, Set<NodeId> seeds) {
        Set<NodeId> reached = new HashSet<>(seeds);
        Deque<NodeId> work = new ArrayDeque<>(seeds);
        while (!work.isEmpty()) {
            NodeSlot slot = nodes.get(work.poll());
            if (slot == null) {
                continue;
            }
            for (EdgeId edgeId : traversableEdges(slot)) {
                EdgeSlot edge = edges.get(edgeId);
                if (edge == null) {
                    continue;
                }
                NodeId next = edge.opposite(slot.id);
                if (partition.members.contains(next) && reached.add(next)) {
                    work.add(next);
                }
            }
        }
        return reached;
    }

    private void removeNode(NodeSlot slot, Deletion deletion) {
        for (EdgeId edgeId : slot.incidentEdges()) {
            EdgeSlot edge = edges.get(edgeId);
            if (edge != null) {
                removeEdge(edge, deletion);
            }
        }
        nodes.remove(slot.id);
        Partition partition = partitions.get(slot.root);
        if (partition != null) {
            partition.members.remove(slot.id);
        }
        deletion.nodes++;
        deletion.count++;
        deletion.touched.remove(slot.id);
        if (slot.persistent) {
            deletion.unsaved.add(slot.id);
        }
    }

    private void removeEdge(EdgeSlot edge, Deletion deletion) {
        if (edges.remove(edge.id) == null) {
            return;
        }
        NodeSlot source = nodes.get(edge.source);
        if (source != null) {
            source.outgoing.remove(edge.id);
            deletion.touched.add(edge.source);
        }
        NodeSlot target = nodes.get(edge.target);
        if (target != null) {
            target.incoming.remove(edge.id);
            deletion.touched.add(edge.target);
        }
        deletion.edges++;
        deletion.count++;
        if (edge.persistent) {
            deletion.unsaved.add(edge.id);
        }
    }

    /**
     * Collects the effects of a deletion so they can be reported to the
     * persistence collaborator in one pass before partition locks are released.
     */
    private final class Deletion {
        final Set<NodeId> touched = new LinkedHashSet<>();
        final List<ElementId> unsaved = new ArrayList<>();
        int nodes;
        int edges;
        int count;

        void flush() {
            unsaved.forEach(persistence::remove);
            for (NodeId id : touched) {
                NodeSlot slot = InMemoryGraphStore.this.nodes.get(id);
                if (slot != null && slot.persistent) {
                    persistence.save(slot.snapshot());
                }
            }
        }
    }

    private static final class Partition {
        final NodeId root;
        final String key;
        final Set<NodeId> members = ConcurrentHashMap.newKeySet();
        final Map<NodeId, AccessLevel> grants = new ConcurrentHashMap<>();

        Partition(NodeId root, String key) {
            this.root = root;
            this.key = key;
        }

        @Override
        public String toString() {
            return "Partition{" + key + "@" + root + "}";
        }
    }

    private static final class NodeSlot {
        final NodeId id;
        final Archetype type;
        final NodeId root;
        final Map<String, Object> attributes = new ConcurrentHashMap<>();
        final List<EdgeId> outgoing = new CopyOnWriteArrayList<>();
        final List<EdgeId> incoming = new CopyOnWriteArrayList<>();
        volatile boolean persistent;

        NodeSlot(NodeId id, Archetype type, NodeId root) {
            this.id = id;
            this.type = type;
            this.root = root;
        }

        boolean isRoot() {
            return id.equals(root);
        }

        Set<EdgeId> incidentEdges() {
            Set<EdgeId> ids = new LinkedHashSet<>(outgoing);
            ids.addAll(incoming);
            return ids;
        }

        Node snapshot() {
            return Node.builder()
                    .id(id)
                    .type(type)
                    .rootId(root)
                    .attributes(attributes)
                    .outgoing(outgoing)
                    .incoming(incoming)
                    .persistent(persistent)
                    .build();
        }
    }

    private static final class EdgeSlot {
        final EdgeId id;
        final Archetype type;
        final NodeId root;
        final NodeId source;
        final NodeId target;
        final EdgeDirection direction;
        final Map<String, Object> attributes = new ConcurrentHashMap<>();
        volatile boolean persistent;

        EdgeSlot(EdgeId id, Archetype type, NodeId root, NodeId source, NodeId target, EdgeDirection direction) {
            this.id = id;
            this.type = type;
            this.root = root;
            this.source = source;
            this.target = target;
            this.direction = direction;
        }

        boolean isUndirected() {
            return direction == EdgeDirection.UNDIRECTED;
        }

        NodeId opposite(NodeId node) {
            return source.equals(node) ? target : source;
        }

        Edge snapshot() {
            return Edge.builder()
                    .id(id)
                    .type(type)
                    .rootId(root)
                    .source(source)
                    .target(target)
                    .direction(direction)
                    .attributes(attributes)
                    .persistent(persistent)
                    .build();
        }
    }
}
