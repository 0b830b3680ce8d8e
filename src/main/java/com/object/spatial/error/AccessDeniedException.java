package com.object.spatial.error;

import com.object.spatial.core.model.AccessLevel;
import com.object.spatial.core.model.NodeId;

/**
 * Raised when a root operates on another root's partition without a sufficient grant.
 */
public class AccessDeniedException extends ObjectSpatialException {

    private final NodeId actingRoot;
    private final NodeId targetRoot;
    private final AccessLevel required;

    public AccessDeniedException(NodeId actingRoot, NodeId targetRoot, AccessLevel required) {
        super("Root " + actingRoot + " lacks " + required + " access to partition of root " + targetRoot);
        this.actingRoot = actingRoot;
        this.targetRoot = targetRoot;
        this.required = required;
    }

    public NodeId getActingRoot() {
        return actingRoot;
    }

    public NodeId getTargetRoot() {
        return targetRoot;
    }

    public AccessLevel getRequired() {
        return required;
    }
}
