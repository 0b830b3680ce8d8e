package com.object.spatial.walker;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.NodeId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One walker instance: fields, traversal queue, pending-exit stack, path and reports.
 *
 * <p>Instances are never shared between spawns. The queue and stack may only be
 * changed by the thread driving the walker; other threads may take snapshots
 * (for reclamation) and append reports.</p>
 */
public final class Walker {

    private final String id;
    private final WalkerType type;
    private final NodeId actingRoot;
    private final Map<String, Object> fields;
    private final List<QueuedVisit> queue = new ArrayList<>();
    private final Deque<TraversalFrame> stack = new ArrayDeque<>();
    private final List<ElementId> path = new ArrayList<>();
    private final List<Object> reports = Collections.synchronizedList(new ArrayList<>());
    private final Set<ElementId> ignored = new HashSet<>();
    private final Set<ElementId> exited = new HashSet<>();

    private volatile WalkerState state = WalkerState.CREATED;
    private volatile WalkerOutcome outcome;
    private volatile boolean disengaged;
    private volatile Thread driver;

    /**
     * @param fields validated field values, defaults applied
     */
    public Walker(String id, WalkerType type, NodeId actingRoot, Map<String, Object> fields) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.type = Objects.requireNonNull(type, "type is required");
        this.actingRoot = actingRoot;
        this.fields = new HashMap<>(fields);
    }

    public String getId() {
        return id;
    }

    public WalkerType getType() {
        return type;
    }

    /**
     * Root whose access grants apply to this walker's visits.
     */
    public NodeId getActingRoot() {
        return actingRoot;
    }

    public WalkerState getState() {
        return state;
    }

    /**
     * How the walker finished; null until {@link WalkerState#DONE}.
     */
    public WalkerOutcome getOutcome() {
        return outcome;
    }

    public boolean isDisengaged() {
        return disengaged;
    }

    public Object getField(String name) {
        return fields.get(name);
    }

    /**
     * Sets a declared field.
     *
     * @throws IllegalArgumentException if the walker type does not declare {@code name}
     */
    public void setField(String name, Object value) {
        if (!type.getFields().containsKey(name)) {
            throw new IllegalArgumentException(type.getName() + " has no field '" + name + "'");
        }
        fields.put(name, value);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(new HashMap<>(fields));
    }

    public synchronized List<ElementId> getPath() {
        return List.copyOf(path);
    }

    public List<Object> getReports() {
        synchronized (reports) {
            return Collections.unmodifiableList(new ArrayList<>(reports));
        }
    }

    public synchronized int getQueueSize() {
        return queue.size();
    }

    public synchronized int getPendingExitDepth() {
        return stack.size();
    }

    /**
     * Elements this walker still refers to: its path and every queued target.
     */
    public synchronized Set<ElementId> liveReferences() {
        Set<ElementId> refs = new LinkedHashSet<>(path);
        for (QueuedVisit visit : queue) {
            refs.add(visit.target());
        }
        return refs;
    }

    @Override
    public String toString() {
        return "Walker{" + type.getName() + ":" + id + ", state=" + state + "}";
    }

    // ========== Engine-facing state transitions ==========

    void report(Object value) {
        reports.add(value);
    }

    void disengage() {
        disengaged = true;
    }

    void start() {
        if (state != WalkerState.CREATED) {
            throw new IllegalStateException("Walker " + id + " has already been started");
        }
        driver = Thread.currentThread();
        state = WalkerState.RUNNING;
    }

    synchronized void finish(WalkerOutcome result) {
        queue.clear();
        stack.clear();
        outcome = result;
        state = WalkerState.DONE;
        driver = null;
    }

    boolean isIgnored(ElementId element) {
        return ignored.contains(element);
    }

    void ignore(ElementId element) {
        requireDriver();
        ignored.add(element);
    }

    /**
     * Marks an element as exited.
     *
     * @return false if it had already exited in this run
     */
    boolean markExited(ElementId element) {
        return exited.add(element);
    }

    /**
     * Inserts visits at a queue position. Negative positions count from the tail,
     * {@code -1} being the end; positions past either end clamp.
     */
    synchronized void insert(int index, List<QueuedVisit> visits) {
        requireDriver();
        int size = queue.size();
        int position;
        if (index < 0) {
            position = Math.max(0, index + size + 1);
        } else {
            position = Math.min(index, size);
        }
        queue.addAll(position, visits);
    }

    synchronized QueuedVisit poll() {
        requireDriver();
        return queue.isEmpty() ? null : queue.remove(0);
    }

    synchronized void appendPath(ElementId element) {
        path.add(element);
    }

    synchronized void pushFrame(TraversalFrame frame) {
        requireDriver();
        stack.push(frame);
    }

    synchronized TraversalFrame peekFrame() {
        return stack.peek();
    }

    synchronized void popFrame() {
        requireDriver();
        stack.pop();
    }

    private void requireDriver() {
        if (state != WalkerState.RUNNING) {
            throw new IllegalStateException("Walker " + id + " is not running");
        }
        if (driver != Thread.currentThread()) {
            throw new IllegalStateException(
                    "Walker " + id + " can only be re-routed from the thread driving it");
        }
    }
}
