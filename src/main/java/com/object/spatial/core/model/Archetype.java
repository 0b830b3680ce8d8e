package com.object.spatial.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type tag of a node, edge or walker.
 *
 * <p>An archetype carries its ordered parents and declared fields. The method
 * resolution order used for ability dispatch is computed once, with C3
 * linearization, when the archetype is built. Parents must be of the same kind.</p>
 *
 * <p>Equality is by kind and name: two archetypes with the same name and kind
 * are interchangeable as dispatch keys.</p>
 *
 * <pre>
 * Archetype place = Archetype.node("Place").build();
 * Archetype city = Archetype.node("City").parent(place)
 *         .field(FieldSpec.required("name"))
 *         .build();
 * Archetype road = Archetype.edge("Road").connects(city, city).build();
 * </pre>
 */
public final class Archetype {

    /**
     * Built-in type of every root node.
     */
    public static final Archetype ROOT = node("Root").build();

    /**
     * Edge type used when a connect does not name one.
     */
    public static final Archetype GENERIC_EDGE = edge("GenericEdge").build();

    private final String name;
    private final ArchetypeKind kind;
    private final List<Archetype> parents;
    private final Map<String, FieldSpec> fields;
    private final List<EndpointRule> endpointRules;
    private final List<Archetype> linearization;

    private Archetype(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.parents = List.copyOf(builder.parents);
        this.endpointRules = List.copyOf(builder.endpointRules);
        this.linearization = Collections.unmodifiableList(linearize());

        // Inherited fields first so subtypes can redeclare them
        Map<String, FieldSpec> all = new LinkedHashMap<>();
        for (int i = linearization.size() - 1; i > 0; i--) {
            all.putAll(linearization.get(i).fields);
        }
        all.putAll(builder.fields);
        this.fields = Collections.unmodifiableMap(all);
    }

    public static Builder node(String name) {
        return new Builder(name, ArchetypeKind.NODE);
    }

    public static Builder edge(String name) {
        return new Builder(name, ArchetypeKind.EDGE);
    }

    public static Builder walker(String name) {
        return new Builder(name, ArchetypeKind.WALKER);
    }

    public String getName() {
        return name;
    }

    public ArchetypeKind getKind() {
        return kind;
    }

    public List<Archetype> getParents() {
        return parents;
    }

    /**
     * Declared fields, inherited ones included, keyed by name.
     */
    public Map<String, FieldSpec> getFields() {
        return fields;
    }

    /**
     * The method resolution order: this archetype followed by every supertype.
     */
    public List<Archetype> getLinearization() {
        return linearization;
    }

    /**
     * Returns true if this archetype is {@code other} or inherits from it.
     */
    public boolean isSubtypeOf(Archetype other) {
        return linearization.contains(other);
    }

    /**
     * Checks whether an edge of this type may join the given endpoint types.
     * Edges without declared rules accept any node types. Rules are inherited.
     */
    public boolean allowsEndpoints(Archetype source, Archetype target) {
        if (kind != ArchetypeKind.EDGE) {
            return false;
        }
        boolean anyRules = false;
        for (Archetype type : linearization) {
            for (EndpointRule rule : type.endpointRules) {
                anyRules = true;
                if (source.isSubtypeOf(rule.source()) && target.isSubtypeOf(rule.target())) {
                    return true;
                }
            }
        }
        return !anyRules;
    }

    private List<Archetype> linearize() {
        List<List<Archetype>> sequences = new ArrayList<>();
        for (Archetype parent : parents) {
            sequences.add(new LinkedList<>(parent.linearization));
        }
        sequences.add(new LinkedList<>(parents));

        List<Archetype> result = new ArrayList<>();
        result.add(this);
        while (true) {
            sequences.removeIf(List::isEmpty);
            if (sequences.isEmpty()) {
                return result;
            }
            Archetype candidate = null;
            for (List<Archetype> seq : sequences) {
                Archetype head = seq.get(0);
                boolean inTail = sequences.stream()
                        .anyMatch(other -> other.indexOf(head) > 0);
                if (!inTail) {
                    candidate = head;
                    break;
                }
            }
            if (candidate == null) {
                throw new IllegalArgumentException(
                        "Cannot compute a consistent method resolution order for " + name);
            }
            result.add(candidate);
            for (List<Archetype> seq : sequences) {
                if (seq.get(0).equals(candidate)) {
                    seq.remove(0);
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Archetype that = (Archetype) o;
        return kind == that.kind && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name;
    }

    private record EndpointRule(Archetype source, Archetype target) {}

    public static class Builder {
        private final String name;
        private final ArchetypeKind kind;
        private final List<Archetype> parents = new ArrayList<>();
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final List<EndpointRule> endpointRules = new ArrayList<>();

        private Builder(String name, ArchetypeKind kind) {
            Objects.requireNonNull(name, "name is required");
            if (name.isBlank()) {
                throw new IllegalArgumentException("archetype name must not be blank");
            }
            this.name = name;
            this.kind = kind;
        }

        /**
         * Adds a parent. Parents are consulted in the order they are added.
         */
        public Builder parent(Archetype parent) {
            Objects.requireNonNull(parent, "parent is required");
            if (parent.kind != kind) {
                throw new IllegalArgumentException(
                        name + " (" + kind + ") cannot extend " + parent.name + " (" + parent.kind + ")");
            }
            parents.add(parent);
            return this;
        }

        public Builder field(FieldSpec field) {
            fields.put(field.name(), field);
            return this;
        }

        /**
         * Restricts an edge type to join {@code source} to {@code target} (or their subtypes).
         * May be called several times to allow several pairs.
         */
        public Builder connects(Archetype source, Archetype target) {
            if (kind != ArchetypeKind.EDGE) {
                throw new IllegalStateException("endpoint rules apply to edge archetypes only");
            }
            if (source.kind != ArchetypeKind.NODE || target.kind != ArchetypeKind.NODE) {
                throw new IllegalArgumentException("edge endpoints must be node archetypes");
            }
            endpointRules.add(new EndpointRule(source, target));
            return this;
        }

        public Archetype build() {
            return new Archetype(this);
        }
    }
}
