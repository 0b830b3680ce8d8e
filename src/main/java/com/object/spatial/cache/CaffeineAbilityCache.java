package com.object.spatial.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.object.spatial.ability.Ability;
import com.object.spatial.core.model.Archetype;
import com.object.spatial.core.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Caffeine-backed ability resolution cache.
 */
public class CaffeineAbilityCache implements AbilityCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAbilityCache.class);

    private final Cache<CacheKey, List<Ability>> cache;

    public CaffeineAbilityCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineAbilityCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public List<Ability> get(Archetype type, Phase phase, Supplier<List<Ability>> resolver) {
        return cache.get(new CacheKey(type, phase), key -> List.copyOf(resolver.get()));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all ability cache entries");
    }

    @Override
    public AbilityCacheStats getStats() {
        CacheStats stats = cache.stats();
        return new AbilityCacheStats(stats.hitCount(), stats.missCount(), cache.estimatedSize());
    }

    record CacheKey(Archetype type, Phase phase) {}
}
