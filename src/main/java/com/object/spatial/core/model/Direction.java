package com.object.spatial.core.model;

/**
 * Direction of traversal relative to the origin node.
 */
public enum Direction {
    OUT,
    IN,
    ANY;

    public boolean includesOutgoing() {
        return this == OUT || this == ANY;
    }

    public boolean includesIncoming() {
        return this == IN || this == ANY;
    }
}
