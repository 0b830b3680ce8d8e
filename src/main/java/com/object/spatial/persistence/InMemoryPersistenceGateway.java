package com.object.spatial.persistence;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;
import com.object.spatial.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory persistence gateway that keeps the latest saved snapshot of each element.
 * Thread-safe. Suitable for tests and for sharing roots between runtimes in one JVM.
 */
public class InMemoryPersistenceGateway implements PersistenceGateway {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceGateway.class);

    private final Map<String, NodeId> rootsByKey = new ConcurrentHashMap<>();
    private final Map<ElementId, GraphElement> saved = new ConcurrentHashMap<>();
    private final AtomicLong saveCount = new AtomicLong();
    private final AtomicLong highestId = new AtomicLong();

    @Override
    public Optional<Node> loadRoot(String rootKey) {
        NodeId id = rootsByKey.get(rootKey);
        if (id == null) {
            return Optional.empty();
        }
        GraphElement element = saved.get(id);
        return element instanceof Node node ? Optional.of(node) : Optional.empty();
    }

    @Override
    public void registerRoot(String rootKey, Node root) {
        rootsByKey.put(rootKey, root.getId());
        save(root);
    }

    @Override
    public void save(GraphElement element) {
        saved.put(element.getId(), element);
        saveCount.incrementAndGet();
        highestId.accumulateAndGet(element.getId().value(), Math::max);
        log.trace("Saved {}", element);
    }

    @Override
    public void remove(ElementId id) {
        if (saved.remove(id) != null) {
            log.trace("Removed {}", id);
        }
    }

    @Override
    public long reserveIds(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        long first = highestId.getAndAdd(count) + 1;
        log.trace("Reserved ids {}..{}", first, first + count - 1);
        return first;
    }

    /**
     * Returns the last saved snapshot of an element.
     */
    public Optional<GraphElement> find(ElementId id) {
        return Optional.ofNullable(saved.get(id));
    }

    public boolean contains(ElementId id) {
        return saved.containsKey(id);
    }

    public int size() {
        return saved.size();
    }

    /**
     * Total number of save calls received, including re-saves of the same element.
     */
    public long getSaveCount() {
        return saveCount.get();
    }
}
