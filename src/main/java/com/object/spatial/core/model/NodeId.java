package com.object.spatial.core.model;

/**
 * Identity of a node.
 */
public record NodeId(long value) implements ElementId, Comparable<NodeId> {

    public NodeId {
        if (value <= 0) {
            throw new IllegalArgumentException("node id must be > 0");
        }
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "n" + value;
    }
}
