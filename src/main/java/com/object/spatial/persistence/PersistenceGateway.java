package com.object.spatial.persistence;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.GraphElement;
import com.object.spatial.core.model.Node;

import java.util.Optional;

/**
 * External storage collaborator. The graph store calls it whenever a
 * root-reachable element changes; it is agnostic to the storage backend.
 */
public interface PersistenceGateway {

    /**
     * Loads a previously saved root node for a tenant/session key.
     *
     * @param rootKey the caller-chosen root key
     * @return the root node, or empty if none was saved
     */
    Optional<Node> loadRoot(String rootKey);

    /**
     * Records that a root was created for a key, so {@link #loadRoot} can find it.
     */
    void registerRoot(String rootKey, Node root);

    /**
     * Saves the current state of a persistent node or edge.
     */
    void save(GraphElement element);

    /**
     * Removes a previously saved element.
     */
    void remove(ElementId id);

    /**
     * Reserves a block of element ids. Ids handed out are never handed out again,
     * to this store or to any other store sharing the same backend, and are above
     * every id the backend has saved.
     *
     * @param count number of consecutive ids to reserve, at least 1
     * @return the first id of the block
     */
    long reserveIds(int count);
}
