package com.object.spatial.graph;

import com.object.spatial.core.model.NodeId;

/**
 * Outcome of a reachability sweep over one root partition.
 *
 * @param root            the swept partition's root
 * @param nodesReclaimed  ephemeral nodes deleted
 * @param edgesReclaimed  edges deleted along with them
 * @param nodesRetained   nodes left in the partition, root included
 */
public record SweepResult(NodeId root, int nodesReclaimed, int edgesReclaimed, int nodesRetained) {

    public int totalReclaimed() {
        return nodesReclaimed + edgesReclaimed;
    }
}
