package com.object.spatial.walker;

import com.object.spatial.core.model.GraphElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Pending-exit stack entry.
 *
 * <p>A frame is owned by an element whose entry enqueued at least one visit, or, at
 * the bottom of the stack, by the spawn itself (owner null). It counts the queued
 * visits it is still waiting on and collects, in entry order, the members that
 * completed without enqueuing anything; their exits run when the frame is popped,
 * ahead of the owner's exit.</p>
 */
final class TraversalFrame {

    private final GraphElement owner;
    private final TraversalFrame parent;
    private final List<GraphElement> completed = new ArrayList<>();
    private int pending;

    private TraversalFrame(GraphElement owner, TraversalFrame parent) {
        this.owner = owner;
        this.parent = parent;
    }

    static TraversalFrame forSpawn() {
        return new TraversalFrame(null, null);
    }

    static TraversalFrame forEntry(GraphElement owner, TraversalFrame parent) {
        return new TraversalFrame(owner, parent);
    }

    GraphElement owner() {
        return owner;
    }

    TraversalFrame parent() {
        return parent;
    }

    /**
     * The frame visits issued while this frame unwinds attach to.
     */
    TraversalFrame openAncestor() {
        return parent != null ? parent : this;
    }

    void expect(int visits) {
        pending += visits;
    }

    void visitCompleted() {
        pending--;
    }

    boolean hasPending() {
        return pending > 0;
    }

    void addCompleted(GraphElement element) {
        completed.add(element);
    }

    List<GraphElement> drainCompleted() {
        List<GraphElement> drained = new ArrayList<>(completed);
        completed.clear();
        return drained;
    }

    @Override
    public String toString() {
        return "TraversalFrame{owner=" + (owner != null ? owner.getId() : "spawn") + ", pending=" + pending + "}";
    }
}
