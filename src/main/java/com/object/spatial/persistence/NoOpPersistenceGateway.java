package com.object.spatial.persistence;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persistence gateway that stores nothing. Used when the graph lives only in memory;
 * ids are still reserved so one store never reuses them.
 */
public class NoOpPersistenceGateway implements PersistenceGateway {

    private final AtomicLong issued = new AtomicLong();

    @Override
    public Optional<Node> loadRoot(String rootKey) {
        return Optional.empty();
    }

    @Override
    public void registerRoot(String rootKey, Node root) {
    }

    @Override
    public void save(GraphElement element) {
    }

    @Override
    public void remove(ElementId id) {
    }

    @Override
    public long reserveIds(int count) {
        return issued.getAndAdd(count) + 1;
    }
}
