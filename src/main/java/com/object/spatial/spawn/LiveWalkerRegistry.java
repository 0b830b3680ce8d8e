package com.object.spatial.spawn;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.walker.Walker;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Walkers currently running. A sweep keeps every element they still refer to.
 */
public class LiveWalkerRegistry {

    private final Map<String, Walker> running = new ConcurrentHashMap<>();

    void register(Walker walker) {
        running.put(walker.getId(), walker);
    }

    void unregister(Walker walker) {
        running.remove(walker.getId());
    }

    public int size() {
        return running.size();
    }

    /**
     * Union of the path and queued targets of every running walker.
     */
    public Set<ElementId> liveReferences() {
        Set<ElementId> refs = new HashSet<>();
        for (Walker walker : running.values()) {
            refs.addAll(walker.liveReferences());
        }
        return refs;
    }
}
