package com.object.spatial.cache;

import com.object.spatial.ability.Ability;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Phase;

import java.util.List;
import java.util.function.Supplier;

/**
 * No-op cache implementation: every lookup resolves afresh.
 * Used when caching is disabled.
 */
public class NoOpAbilityCache implements AbilityCache {

    @Override
    public List<Ability> get(Archetype type, Phase phase, Supplier<List<Ability>> resolver) {
        return resolver.get();
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public AbilityCacheStats getStats() {
        return AbilityCacheStats.NONE;
    }
}
