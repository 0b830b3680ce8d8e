package com.object.spatial.walker;

import com.object.spatial.ability.Ability;
import com.object.spatial.ability.AbilityRegistry;
import com.object.spatial.cache.AbilityCache;
import com.object.spatial.cache.NoOpAbilityCache;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.ArchetypeKind;
import com.object.spatial.core.model.FieldSpec;
import com.object.spatial.core.model.Phase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A walker declaration: its archetype (name and fields) and the abilities it carries.
 * Element abilities fire per node or edge; spawn and finish abilities fire once per run.
 *
 * <pre>
 * WalkerType collector = WalkerType.builder("Collector")
 *         .field(FieldSpec.optional("limit", 10))
 *         .onEntryAny(ctx -&gt; {
 *             ctx.visit(TraversalPath.outgoing());
 *             ctx.report(ctx.here().getId());
 *         })
 *         .build();
 * </pre>
 */
public final class WalkerType {

    private final Archetype archetype;
    private final AbilityRegistry abilities;
    private final List<Ability> spawnAbilities;
    private final List<Ability> finishAbilities;

    private WalkerType(Archetype archetype, AbilityRegistry abilities,
                       List<Ability> spawnAbilities, List<Ability> finishAbilities) {
        this.archetype = archetype;
        this.abilities = abilities;
        this.spawnAbilities = List.copyOf(spawnAbilities);
        this.finishAbilities = List.copyOf(finishAbilities);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return archetype.getName();
    }

    public Archetype getArchetype() {
        return archetype;
    }

    public Map<String, FieldSpec> getFields() {
        return archetype.getFields();
    }

    public AbilityRegistry getAbilities() {
        return abilities;
    }

    /**
     * Abilities run once per spawn, on the spawn location, before the first element is entered.
     */
    public List<Ability> getSpawnAbilities() {
        return spawnAbilities;
    }

    /**
     * Abilities run once per spawn after traversal ends, on the last element entered.
     */
    public List<Ability> getFinishAbilities() {
        return finishAbilities;
    }

    @Override
    public String toString() {
        return "WalkerType{" + archetype.getName() + "}";
    }

    public static class Builder {
        private final Archetype.Builder archetype;
        private final List<Registration> registrations = new ArrayList<>();
        private final List<Ability> spawnAbilities = new ArrayList<>();
        private final List<Ability> finishAbilities = new ArrayList<>();
        private AbilityCache abilityCache = new NoOpAbilityCache();

        private Builder(String name) {
            this.archetype = Archetype.walker(name);
        }

        /**
         * Inherits the fields of another walker archetype.
         */
        public Builder parent(Archetype parent) {
            archetype.parent(parent);
            return this;
        }

        public Builder field(FieldSpec field) {
            archetype.field(field);
            return this;
        }

        public Builder onEntry(Archetype type, Ability ability) {
            return on(requireElementType(type), Phase.ENTRY, ability);
        }

        public Builder onExit(Archetype type, Ability ability) {
            return on(requireElementType(type), Phase.EXIT, ability);
        }

        /**
         * Entry ability for every node and edge.
         */
        public Builder onEntryAny(Ability ability) {
            return on(null, Phase.ENTRY, ability);
        }

        public Builder onExitAny(Ability ability) {
            return on(null, Phase.EXIT, ability);
        }

        /**
         * Runs once when the walker is spawned, with {@code here} bound to the spawn
         * location. Visits issued here are queued behind the spawn targets.
         */
        public Builder onSpawn(Ability ability) {
            spawnAbilities.add(Objects.requireNonNull(ability, "ability is required"));
            return this;
        }

        /**
         * Runs once after the queue and pending exits drain, with {@code here} bound to the
         * last element entered. Skipped when the walker disengages. Visits issued here are
         * not followed.
         */
        public Builder onFinish(Ability ability) {
            finishAbilities.add(Objects.requireNonNull(ability, "ability is required"));
            return this;
        }

        public Builder abilityCache(AbilityCache abilityCache) {
            this.abilityCache = Objects.requireNonNull(abilityCache, "abilityCache is required");
            return this;
        }

        public WalkerType build() {
            AbilityRegistry registry = new AbilityRegistry(abilityCache);
            for (Registration r : registrations) {
                registry.register(r.type(), r.phase(), r.ability());
            }
            return new WalkerType(archetype.build(), registry, spawnAbilities, finishAbilities);
        }

        private Builder on(Archetype type, Phase phase, Ability ability) {
            registrations.add(new Registration(type, phase, Objects.requireNonNull(ability, "ability is required")));
            return this;
        }

        private static Archetype requireElementType(Archetype type) {
            Objects.requireNonNull(type, "type is required; use onEntryAny/onExitAny for every element");
            if (type.getKind() == ArchetypeKind.WALKER) {
                throw new IllegalArgumentException("abilities trigger on node or edge archetypes, not " + type);
            }
            return type;
        }

        private record Registration(Archetype type, Phase phase, Ability ability) {}
    }
}
