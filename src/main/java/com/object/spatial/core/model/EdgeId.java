package com.object.spatial.core.model;

/**
 * Identity of an edge.
 */
public record EdgeId(long value) implements ElementId, Comparable<EdgeId> {

    public EdgeId {
        if (value <= 0) {
            throw new IllegalArgumentException("edge id must be > 0");
        }
    }

    @Override
    public int compareTo(EdgeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "e" + value;
    }
}
