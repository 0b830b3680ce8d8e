package com.object.spatial.api;

import com.object.spatial.core.model.ElementId;
import com.object.spatial.core.model.NodeId;
import com.object.spatial.walker.WalkerType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A spawn to perform: walker type, initial targets in order, field values, and
 * optionally the root the walker acts for (defaults to the first target's root).
 */
public record SpawnRequest(WalkerType walkerType, List<ElementId> targets,
                           Map<String, Object> fields, NodeId actingRoot) {

    public SpawnRequest {
        Objects.requireNonNull(walkerType, "walkerType is required");
        targets = targets != null ? List.copyOf(targets) : List.of();
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public static SpawnRequest of(WalkerType walkerType, ElementId target) {
        return new SpawnRequest(walkerType, List.of(target), Map.of(), null);
    }

    public static SpawnRequest of(WalkerType walkerType, List<? extends ElementId> targets,
                                  Map<String, Object> fields) {
        return new SpawnRequest(walkerType, List.copyOf(targets), fields, null);
    }
}
