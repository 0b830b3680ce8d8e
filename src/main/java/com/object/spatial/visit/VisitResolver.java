package com.object.spatial.visit;

import com.object.spatial.core.model.AccessLevel;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.error.FilterEvaluationException;
import com.object.spatial.graph.GraphStore;
import com.object.spatial.graph.Neighbor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Evaluates {@link TraversalPath} expressions against the graph.
 *
 * <p>Candidates keep edge-creation order and are deduplicated per hop, first
 * occurrence wins. Candidates in a partition the acting root cannot read are
 * dropped. An exception thrown by a filter predicate surfaces as a
 * {@link FilterEvaluationException}.</p>
 */
public class VisitResolver {
    private static final Logger log = LoggerFactory.getLogger(VisitResolver.class);

    private final GraphStore graphStore;

    public VisitResolver(GraphStore graphStore) {
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore is required");
    }

    /**
     * Resolves a path from {@code here}. When {@code here} is an edge the path starts at its target.
     *
     * @param actingRoot root the walker acts for; null skips access filtering
     * @return ids to enqueue, in order
     */
    public List<ElementId> resolve(GraphElement here, TraversalPath path, NodeId actingRoot) {
        Objects.requireNonNull(here, "here is required");
        Objects.requireNonNull(path, "path is required");

        NodeId origin = here instanceof Edge edge ? edge.getTarget() : ((Node) here).getId();
        List<NodeId> frontier = List.of(origin);
        List<Hop> hops = path.getHops();

        for (int i = 0; i < hops.size(); i++) {
            Hop hop = hops.get(i);
            boolean last = i == hops.size() - 1;
            Map<NodeId, Node> reached = new LinkedHashMap<>();
            List<ElementId> withEdges = new ArrayList<>();
            Set<ElementId> seenEdges = new LinkedHashSet<>();

            for (NodeId from : frontier) {
                for (Neighbor neighbor : graphStore.neighbors(from, hop.direction(), null)) {
                    Node node = neighbor.node();
                    if (!readable(actingRoot, node)) {
                        continue;
                    }
                    if (!evaluate(neighbor.edge(), hop::acceptsEdge) || !evaluate(node, hop::acceptsNode)) {
                        continue;
                    }
                    reached.putIfAbsent(node.getId(), node);
                    if (last && path.isEdgesIncluded() && seenEdges.add(neighbor.edge().getId())) {
                        withEdges.add(neighbor.edge().getId());
                        withEdges.add(node.getId());
                    }
                }
            }

            if (last) {
                return path.isEdgesIncluded() ? withEdges : new ArrayList<>(reached.keySet());
            }
            frontier = new ArrayList<>(reached.keySet());
        }
        return List.of();
    }

    /**
     * Expands explicit targets: nodes stand for themselves, edges for the edge followed
     * by its target node. Unknown ids are dropped.
     */
    public List<ElementId> expand(Collection<? extends ElementId> targets) {
        List<ElementId> expanded = new ArrayList<>();
        for (ElementId id : targets) {
            GraphElement element = graphStore.find(id).orElse(null);
            if (element == null) {
                log.debug("Dropping unknown visit target {}", id);
                continue;
            }
            expanded.add(id);
            if (element instanceof Edge edge) {
                expanded.add(edge.getTarget());
            }
        }
        return expanded;
    }

    private boolean readable(NodeId actingRoot, Node node) {
        if (actingRoot == null || actingRoot.equals(node.getRootId())) {
            return true;
        }
        return graphStore.accessLevel(actingRoot, node.getRootId()).allows(AccessLevel.READ);
    }

    private static <T extends GraphElement> boolean evaluate(T element, Predicate<T> filter) {
        try {
            return filter.test(element);
        } catch (FilterEvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FilterEvaluationException("Visit filter failed on " + element.getId(), e);
        }
    }
}
