package com.object.spatial.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a node: identity, type, attributes and incident edges in creation order.
 */
public final class Node implements GraphElement {

    private final NodeId id;
    private final Archetype type;
    private final NodeId rootId;
    private final Map<String, Object> attributes;
    private final List<EdgeId> outgoing;
    private final List<EdgeId> incoming;
    private final boolean persistent;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.rootId = builder.rootId != null ? builder.rootId : builder.id;
        this.attributes = builder.attributes != null ? Map.copyOf(builder.attributes) : Map.of();
        this.outgoing = builder.outgoing != null ? List.copyOf(builder.outgoing) : List.of();
        this.incoming = builder.incoming != null ? List.copyOf(builder.incoming) : List.of();
        this.persistent = builder.persistent;
        if (type.getKind() != ArchetypeKind.NODE) {
            throw new IllegalArgumentException("node type must be a NODE archetype: " + type);
        }
    }

    @Override
    public NodeId getId() {
        return id;
    }

    @Override
    public Archetype getType() {
        return type;
    }

    @Override
    public NodeId getRootId() {
        return rootId;
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public List<EdgeId> getOutgoing() {
        return outgoing;
    }

    public List<EdgeId> getIncoming() {
        return incoming;
    }

    @Override
    public boolean isPersistent() {
        return persistent;
    }

    public boolean isRoot() {
        return id.equals(rootId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return id.equals(node.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return type.getName() + "[" + id + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NodeId id;
        private Archetype type;
        private NodeId rootId;
        private Map<String, Object> attributes;
        private List<EdgeId> outgoing;
        private List<EdgeId> incoming;
        private boolean persistent;

        public Builder id(NodeId id) {
            this.id = id;
            return this;
        }

        public Builder type(Archetype type) {
            this.type = type;
            return this;
        }

        public Builder rootId(NodeId rootId) {
            this.rootId = rootId;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder outgoing(List<EdgeId> outgoing) {
            this.outgoing = outgoing;
            return this;
        }

        public Builder incoming(List<EdgeId> incoming) {
            this.incoming = incoming;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
