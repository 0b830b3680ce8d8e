package com.object.spatial.ability;

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
 * Abilities declared on node and edge archetypes, fired when a walker enters or
 * leaves an element of that archetype.
 *
 * <p>A handler either fires for every visiting walker or only for walkers of a given
 * walker archetype (subtypes included). Both lookups walk the element's method
 * resolution order; walker-specific lookups also walk the visiting walker's, so a
 * handler bound to a walker supertype fires for its subtypes.</p>
 *
 * <pre>
 * runtime.elementAbilities()
 *         .onEntry(city, ctx -&gt; ctx.report("city greets any walker"))
 *         .onEntry(city, inspector, ctx -&gt; ctx.report("city greets an inspector"));
 * </pre>
 */
public class ElementAbilityRegistry {
    private static final Logger log = LoggerFactory.getLogger(ElementAbilityRegistry.class);

    private final Map<Key, List<Ability>> handlers = new ConcurrentHashMap<>();

    public ElementAbilityRegistry onEntry(Archetype elementType, Ability ability) {
        return register(elementType, null, Phase.ENTRY, ability);
    }

    public ElementAbilityRegistry onEntry(Archetype elementType, Archetype walkerType, Ability ability) {
        return register(elementType, Objects.requireNonNull(walkerType, "walkerType is required"),
                Phase.ENTRY, ability);
    }

    public ElementAbilityRegistry onExit(Archetype elementType, Ability ability) {
        return register(elementType, null, Phase.EXIT, ability);
    }

    public ElementAbilityRegistry onExit(Archetype elementType, Archetype walkerType, Ability ability) {
        return register(elementType, Objects.requireNonNull(walkerType, "walkerType is required"),
                Phase.EXIT, ability);
    }

    /**
     * @param walkerType walker archetype the handler is restricted to; null for every walker
     */
    public ElementAbilityRegistry register(Archetype elementType, Archetype walkerType, Phase phase, Ability ability) {
        Objects.requireNonNull(elementType, "elementType is required");
        Objects.requireNonNull(phase, "phase is required");
        Objects.requireNonNull(ability, "ability is required");
        if (elementType.getKind() == ArchetypeKind.WALKER) {
            throw new IllegalArgumentException("element abilities belong to node or edge archetypes, not " + elementType);
        }
        if (walkerType != null && walkerType.getKind() != ArchetypeKind.WALKER) {
            throw new IllegalArgumentException(walkerType + " is not a walker archetype");
        }
        handlers.computeIfAbsent(new Key(elementType, walkerType, phase), k -> new CopyOnWriteArrayList<>()).add(ability);
        log.debug("Registered {} ability on {} for {}", phase, elementType,
                walkerType != null ? walkerType : "any walker");
        return this;
    }

    /**
     * Handlers of {@code elementType} that fire for every walker.
     */
    public List<Ability> resolveForAnyWalker(Archetype elementType, Phase phase) {
        if (handlers.isEmpty()) {
            return List.of();
        }
        List<Ability> resolved = new ArrayList<>();
        for (Archetype element : elementType.getLinearization()) {
            resolved.addAll(handlers.getOrDefault(new Key(element, null, phase), List.of()));
        }
        return resolved;
    }

    /**
     * Handlers of {@code elementType} restricted to walkers that {@code walkerType} is
     * or inherits from.
     */
    public List<Ability> resolveForWalker(Archetype elementType, Archetype walkerType, Phase phase) {
        if (handlers.isEmpty()) {
            return List.of();
        }
        List<Ability> resolved = new ArrayList<>();
        for (Archetype element : elementType.getLinearization()) {
            for (Archetype walker : walkerType.getLinearization()) {
                resolved.addAll(handlers.getOrDefault(new Key(element, walker, phase), List.of()));
            }
        }
        return resolved;
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    private record Key(Archetype elementType, Archetype walkerType, Phase phase) {}
}
