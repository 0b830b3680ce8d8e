package com.object.spatial.visit;

import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Direction;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * One step of a {@link TraversalPath}: a direction plus optional edge and node filters.
 * Empty type sets accept every archetype; null predicates accept every element.
 */
public record Hop(Direction direction,
                  Set<Archetype> edgeTypes,
                  Predicate<Edge> edgeFilter,
                  Set<Archetype> nodeTypes,
                  Predicate<Node> nodeFilter) {

    public Hop {
        Objects.requireNonNull(direction, "direction is required");
        edgeTypes = edgeTypes != null ? Set.copyOf(edgeTypes) : Set.of();
        nodeTypes = nodeTypes != null ? Set.copyOf(nodeTypes) : Set.of();
    }

    boolean acceptsEdge(Edge edge) {
        return matchesType(edge, edgeTypes) && (edgeFilter == null || edgeFilter.test(edge));
    }

    boolean acceptsNode(Node node) {
        return matchesType(node, nodeTypes) && (nodeFilter == null || nodeFilter.test(node));
    }

    private static boolean matchesType(GraphElement element, Set<Archetype> types) {
        if (types.isEmpty()) {
            return true;
        }
        for (Archetype type : types) {
            if (element.getType().isSubtypeOf(type)) {
                return true;
            }
        }
        return false;
    }
}
