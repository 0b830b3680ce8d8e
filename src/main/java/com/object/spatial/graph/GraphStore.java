package com.object.spatial.graph;

import com.object.spatial.core.model.AccessLevel;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Direction;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.EdgeDirection;
import com.object.spatial.core.model.EdgeId;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Owner of all nodes and edges: identity, adjacency, root partitions and persistence marking.
 *
 * <p>Every node belongs to the partition of exactly one root. Elements reachable from
 * their root are persistent and are handed to the persistence collaborator whenever
 * they change. Cross-root edges are only created when the target root has granted
 * {@link AccessLevel#CONNECT} to the source root.</p>
 *
 * <p>Lookups return immutable snapshots; mutate through the store.</p>
 */
public interface GraphStore {

    /**
     * Gets, loads or creates the root for a tenant/session key.
     *
     * @param rootKey caller-chosen key
     * @return the root node
     */
    Node root(String rootKey);

    /**
     * Returns all known roots in creation order.
     */
    List<NodeId> roots();

    /**
     * Creates a node in the partition of {@code root}. The node is ephemeral
     * until connected into the root's closure.
     *
     * @throws com.object.spatial.error.TypeMismatchException if {@code type} is not a node archetype
     * @throws com.object.spatial.error.NotFoundException     if {@code root} is unknown
     */
    Node createNode(NodeId root, Archetype type, Map<String, Object> attributes);

    /**
     * Creates an edge; updates both endpoints' adjacency atomically.
     *
     * @param type      edge archetype, or null for {@link Archetype#GENERIC_EDGE}
     * @param direction directed or undirected
     * @throws com.object.spatial.error.TypeMismatchException if the edge type rejects the endpoints
     * @throws com.object.spatial.error.AccessDeniedException if the target is in another root's
     *                                                        partition without a CONNECT grant
     */
    Edge createEdge(Archetype type, NodeId source, NodeId target,
                    Map<String, Object> attributes, EdgeDirection direction);

    /**
     * Gets an element.
     *
     * @throws com.object.spatial.error.NotFoundException if the id is stale or unknown
     */
    GraphElement get(ElementId id);

    Node getNode(NodeId id);

    Edge getEdge(EdgeId id);

    Optional<GraphElement> find(ElementId id);

    boolean exists(ElementId id);

    /**
     * Merges attribute values into an element and returns the updated snapshot.
     */
    GraphElement updateAttributes(ElementId id, Map<String, Object> attributes);

    /**
     * Neighbors of a node in edge-creation order.
     *
     * @param edgeFilter predicate over incident edges; null accepts all
     */
    List<Neighbor> neighbors(NodeId node, Direction direction, Predicate<Edge> edgeFilter);

    /**
     * Lazily evaluated form of {@link #neighbors}. Adjacency is captured when the stream
     * is created; elements deleted afterwards are skipped.
     */
    Stream<Neighbor> neighborStream(NodeId node, Direction direction);

    /**
     * Deletes edges between {@code source} and {@code target}.
     *
     * @return number of edges deleted
     */
    int disconnect(NodeId source, NodeId target, Direction direction, Predicate<Edge> edgeFilter);

    /**
     * Deletes an element. Deleting a node also deletes every incident edge.
     *
     * @throws com.object.spatial.error.NotFoundException if the id is stale or unknown
     * @throws IllegalArgumentException                   if the id is a root
     */
    void delete(ElementId id);

    /**
     * Grants {@code grantee} access to the partition of {@code targetRoot}.
     */
    void grant(NodeId targetRoot, NodeId grantee, AccessLevel level);

    void revoke(NodeId targetRoot, NodeId grantee);

    /**
     * Access level {@code actingRoot} holds over the partition of {@code targetRoot}.
     * A root always has {@link AccessLevel#WRITE} over its own partition.
     */
    AccessLevel accessLevel(NodeId actingRoot, NodeId targetRoot);

    /**
     * Deletes ephemeral nodes of one partition that are unreachable from its root
     * and from {@code liveReferences}; recomputes persistence flags.
     */
    SweepResult sweep(NodeId root, Set<ElementId> liveReferences);

    /**
     * Sweeps every partition.
     */
    Collection<SweepResult> sweepAll(Set<ElementId> liveReferences);

    /**
     * Deletes every element of a partition except its root.
     *
     * @return number of nodes and edges deleted
     */
    int resetRoot(NodeId root);

    int nodeCount();

    int edgeCount();
}
