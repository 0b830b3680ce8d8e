package com.object.spatial.cache;

import com.object.spatial.ability.Ability;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Phase;

import java.util.List;
import java.util.function.Supplier;

/**
 * Cache of resolved handler lists, keyed by element archetype and phase.
 */
public interface AbilityCache {

    /**
     * Returns the cached handlers for the key, computing and storing them on a miss.
     *
     * @param type     element archetype
     * @param phase    entry or exit
     * @param resolver computes the handler list on a miss
     * @return the resolved handlers, never null
     */
    List<Ability> get(Archetype type, Phase phase, Supplier<List<Ability>> resolver);

    /**
     * Invalidates all cache entries. Called whenever a handler is registered.
     */
    void invalidateAll();

    AbilityCacheStats getStats();
}
