package com.object.spatial.walker;

import com.object.spatial.core.model.ElementId;

/**
 * A queue entry: the element to enter and the frame that enqueued it.
 */
record QueuedVisit(ElementId target, TraversalFrame origin) {}
