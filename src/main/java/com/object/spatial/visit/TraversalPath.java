package com.object.spatial.visit;

import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Direction;
import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Filter expression describing which neighbors a walker visits.
 *
 * <p>A path has one or more hops evaluated in order from the walker's current
 * location. When edges are included, the last hop yields each matching edge
 * followed by the node at its far end.</p>
 *
 * <pre>
 * TraversalPath roads = TraversalPath.out()
 *         .edgeType(road)
 *         .nodeType(city)
 *         .nodeWhere(n -&gt; ((Integer) n.getAttribute("population")) &gt; 10_000)
 *         .build();
 * </pre>
 */
public final class TraversalPath {

    private final List<Hop> hops;
    private final boolean edgesIncluded;

    private TraversalPath(List<Hop> hops, boolean edgesIncluded) {
        this.hops = List.copyOf(hops);
        this.edgesIncluded = edgesIncluded;
    }

    /**
     * All outgoing neighbors, the equivalent of {@code [-->]}.
     */
    public static TraversalPath outgoing() {
        return out().build();
    }

    public static TraversalPath incoming() {
        return in().build();
    }

    public static TraversalPath adjacent() {
        return any().build();
    }

    public static Builder out() {
        return new Builder(Direction.OUT);
    }

    public static Builder in() {
        return new Builder(Direction.IN);
    }

    public static Builder any() {
        return new Builder(Direction.ANY);
    }

    public List<Hop> getHops() {
        return hops;
    }

    public boolean isEdgesIncluded() {
        return edgesIncluded;
    }

    @Override
    public String toString() {
        return "TraversalPath{hops=" + hops.size() + ", edgesIncluded=" + edgesIncluded + "}";
    }

    public static class Builder {
        private final List<Hop> hops = new ArrayList<>();
        private Direction direction;
        private final Set<Archetype> edgeTypes = new LinkedHashSet<>();
        private Predicate<Edge> edgeFilter;
        private final Set<Archetype> nodeTypes = new LinkedHashSet<>();
        private Predicate<Node> nodeFilter;
        private boolean edgesIncluded;

        private Builder(Direction direction) {
            this.direction = direction;
        }

        /**
         * Accepts edges of any of the given archetypes (or their subtypes).
         */
        public Builder edgeType(Archetype... types) {
            edgeTypes.addAll(Arrays.asList(types));
            return this;
        }

        public Builder edgeWhere(Predicate<Edge> predicate) {
            edgeFilter = edgeFilter == null ? predicate : edgeFilter.and(predicate);
            return this;
        }

        public Builder edgeAttribute(String name, Object value) {
            return edgeWhere(e -> Objects.equals(e.getAttribute(name), value));
        }

        /**
         * Accepts nodes of any of the given archetypes (or their subtypes).
         */
        public Builder nodeType(Archetype... types) {
            nodeTypes.addAll(Arrays.asList(types));
            return this;
        }

        public Builder nodeWhere(Predicate<Node> predicate) {
            nodeFilter = nodeFilter == null ? predicate : nodeFilter.and(predicate);
            return this;
        }

        public Builder nodeAttribute(String name, Object value) {
            return nodeWhere(n -> Objects.equals(n.getAttribute(name), value));
        }

        /**
         * Ends the current hop and starts another from the nodes it matched.
         */
        public Builder then(Direction next) {
            closeHop();
            direction = Objects.requireNonNull(next, "direction is required");
            return this;
        }

        /**
         * Yields each matching edge of the last hop ahead of its far node.
         */
        public Builder includeEdges() {
            edgesIncluded = true;
            return this;
        }

        public TraversalPath build() {
            closeHop();
            return new TraversalPath(hops, edgesIncluded);
        }

        private void closeHop() {
            hops.add(new Hop(direction, edgeTypes, edgeFilter, nodeTypes, nodeFilter));
            edgeTypes.clear();
            edgeFilter = null;
            nodeTypes.clear();
            nodeFilter = null;
        }
    }
}
