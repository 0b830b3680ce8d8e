package com.object.spatial.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of an edge between two nodes.
 */
public final class Edge implements GraphElement {

    private final EdgeId id;
    private final Archetype type;
    private final NodeId rootId;
    private final NodeId source;
    private final NodeId target;
    private final EdgeDirection direction;
    private final Map<String, Object> attributes;
    private final boolean persistent;

    private Edge(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.rootId = Objects.requireNonNull(builder.rootId, "rootId is required");
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.direction = builder.direction != null ? builder.direction : EdgeDirection.DIRECTED;
        this.attributes = builder.attributes != null ? Map.copyOf(builder.attributes) : Map.of();
        this.persistent = builder.persistent;
        if (type.getKind() != ArchetypeKind.EDGE) {
            throw new IllegalArgumentException("edge type must be an EDGE archetype: " + type);
        }
    }

    @Override
    public EdgeId getId() {
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

    public NodeId getSource() {
        return source;
    }

    public NodeId getTarget() {
        return target;
    }

    public EdgeDirection getDirection() {
        return direction;
    }

    public boolean isUndirected() {
        return direction == EdgeDirection.UNDIRECTED;
    }

    /**
     * Returns the endpoint opposite to {@code node}.
     *
     * @throws IllegalArgumentException if {@code node} is not an endpoint of this edge
     */
    public NodeId opposite(NodeId node) {
        if (source.equals(node)) {
            return target;
        }
        if (target.equals(node)) {
            return source;
        }
        throw new IllegalArgumentException(node + " is not an endpoint of " + id);
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean isPersistent() {
        return persistent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return id.equals(edge.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return type.getName() + "[" + id + ": " + source
                + (direction == EdgeDirection.UNDIRECTED ? " <-> " : " -> ") + target + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EdgeId id;
        private Archetype type;
        private NodeId rootId;
        private NodeId source;
        private NodeId target;
        private EdgeDirection direction;
        private Map<String, Object> attributes;
        private boolean persistent;

        public Builder id(EdgeId id) {
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

        public Builder source(NodeId source) {
            this.source = source;
            return this;
        }

        public Builder target(NodeId target) {
            this.target = target;
            return this;
        }

        public Builder direction(EdgeDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Edge build() {
            return new Edge(this);
        }
    }
}
