package com.object.spatial.walker;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.core.model.Phase;
import com.object.spatial.flow.FlowHandle;
import com.object.spatial.graph.GraphStore;
import com.object.spatial.visit.TraversalPath;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * What an ability body sees: the current location, the walker's state, and the
 * operations that steer the traversal.
 *
 * <p>Queue operations ({@code visit}, {@code ignore}) must be called from the ability's
 * own thread; {@link #report} may be called from flow tasks as well.</p>
 */
public interface WalkerContext {

    Walker walker();

    /**
     * The element being entered or exited, as currently stored. Spawn abilities see the
     * spawn location and finish abilities the last element entered. Exits are not run
     * for an element deleted after it was entered.
     */
    GraphElement here();

    /**
     * The current location as a node.
     *
     * @throws IllegalStateException if the walker is on an edge
     */
    Node hereNode();

    Phase phase();

    NodeId actingRoot();

    GraphStore graph();

    Object field(String name);

    <T> T field(String name, Class<T> type);

    void setField(String name, Object value);

    /**
     * Appends the elements {@code path} resolves from here to the queue.
     *
     * @return true if anything was enqueued
     */
    boolean visit(TraversalPath path);

    /**
     * Inserts the elements {@code path} resolves at {@code index}: 0 prepends
     * (depth-first), -1 appends (breadth-first), other negatives count from the tail.
     */
    boolean visit(TraversalPath path, int index);

    /**
     * Enqueues explicit targets. An edge is followed by its target node.
     */
    boolean visit(Collection<? extends ElementId> targets);

    boolean visit(Collection<? extends ElementId> targets, int index);

    boolean visit(ElementId target);

    /**
     * Excludes elements from the rest of this run: they are neither enqueued nor entered.
     */
    void ignore(Collection<? extends ElementId> elements);

    void report(Object value);

    List<Object> reports();

    /**
     * Stops the walker now. Remaining handlers and all pending exits are skipped.
     */
    void disengage();

    Object global(String name);

    <T> FlowHandle<T> flow(Callable<T> task);

    <T> T await(FlowHandle<T> handle);

    <T> T await(FlowHandle<T> handle, Duration timeout);
}
