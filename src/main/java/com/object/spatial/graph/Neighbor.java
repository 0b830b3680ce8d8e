package com.object.spatial.graph;

import com.object.spatial.core.model.Edge;
import com.object.spatial.core.model.Node;

/**
 * An incident edge together with the node at its far end.
 */
public record Neighbor(Edge edge, Node node) {}
