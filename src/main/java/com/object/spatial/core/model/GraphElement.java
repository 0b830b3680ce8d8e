package com.object.spatial.core.model;

import java.util.Map;

/**
 * Read-only view of a node or edge as it was when the view was taken.
 * Views never change; re-read the element from the graph store to observe updates.
 */
public sealed interface GraphElement permits Node, Edge {

    ElementId getId();

    Archetype getType();

    /**
     * The root whose partition owns this element.
     */
    NodeId getRootId();

    Map<String, Object> getAttributes();

    default Object getAttribute(String name) {
        return getAttributes().get(name);
    }

    /**
     * True when the element is reachable from its root and therefore durable.
     */
    boolean isPersistent();

    default boolean isNode() {
        return this instanceof Node;
    }

    default boolean isEdge() {
        return this instanceof Edge;
    }
}
