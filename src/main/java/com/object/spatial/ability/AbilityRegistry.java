package com.object.spatial.ability;

import com.object.spatial.cache.AbilityCache;
import com.object.spatial.cache.NoOpAbilityCache;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.ArchetypeKind;
import com.object.spatial.core.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatch table from (element archetype or wildcard, phase) to ordered handlers.
 *
 * <p>Resolution for an archetype concatenates the handlers registered for the
 * archetype itself, then for each supertype in method resolution order, then the
 * wildcard handlers. Handlers under one key keep registration order. A type with no
 * matching handler resolves to an empty list.</p>
 *
 * <p>Resolved lists are cached; every registration invalidates the cache.</p>
 */
public class AbilityRegistry {
    private static final Logger log = LoggerFactory.getLogger(AbilityRegistry.class);

    private final Map<Key, List<Ability>> handlers = new ConcurrentHashMap<>();
    private final AbilityCache cache;

    public AbilityRegistry() {
        this(new NoOpAbilityCache());
    }

    public AbilityRegistry(AbilityCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
    }

    /**
     * Registers a handler for elements of {@code type} and its subtypes.
     *
     * @param type a node or edge archetype; null registers a wildcard handler
     */
    public AbilityRegistry register(Archetype type, Phase phase, Ability ability) {
        Objects.requireNonNull(phase, "phase is required");
        Objects.requireNonNull(ability, "ability is required");
        if (type != null && type.getKind() == ArchetypeKind.WALKER) {
            throw new IllegalArgumentException("abilities trigger on node or edge archetypes, not " + type);
        }
        handlers.computeIfAbsent(new Key(type, phase), k -> new CopyOnWriteArrayList<>()).add(ability);
        cache.invalidateAll();
        log.debug("Registered {} ability for {}", phase, type != null ? type : "any element");
        return this;
    }

    /**
     * Registers a handler that fires for every element.
     */
    public AbilityRegistry registerAny(Phase phase, Ability ability) {
        return register(null, phase, ability);
    }

    /**
     * Ordered handlers for an element of {@code type}; empty when nothing matches.
     */
    public List<Ability> resolve(Archetype type, Phase phase) {
        return cache.get(type, phase, () -> lookup(type, phase));
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    private List<Ability> lookup(Archetype type, Phase phase) {
        List<Ability> resolved = new ArrayList<>();
        for (Archetype candidate : type.getLinearization()) {
            resolved.addAll(handlers.getOrDefault(new Key(candidate, phase), List.of()));
        }
        resolved.addAll(handlers.getOrDefault(new Key(null, phase), List.of()));
        return resolved;
    }

    private record Key(Archetype type, Phase phase) {}
}
