package com.object.spatial.core.model;

/**
 * Whether an edge is traversable only from source to target, or both ways.
 */
public enum EdgeDirection {
    DIRECTED,
    UNDIRECTED
}
