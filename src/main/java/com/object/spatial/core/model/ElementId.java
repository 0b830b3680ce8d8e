package com.object.spatial.core.model;

/**
 * Opaque identity of a graph element. Values are arena indices handed out
 * by the graph store and are never reused after deletion.
 */
public sealed interface ElementId permits NodeId, EdgeId {

    long value();
}
