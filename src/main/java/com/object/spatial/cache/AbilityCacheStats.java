package com.object.spatial.cache;

/**
 * Counters for ability lookups served by an {@link AbilityCache}.
 *
 * @param hits    lookups answered from the cache
 * @param misses  lookups that had to resolve the ability chain
 * @param entries cached (type, phase) pairs
 */
public record AbilityCacheStats(long hits, long misses, long entries) {

    public static final AbilityCacheStats NONE = new AbilityCacheStats(0, 0, 0);

    public long lookups() {
        return hits + misses;
    }

    /**
     * Fraction of lookups served from the cache; 0 before the first lookup.
     */
    public double hitRatio() {
        return hits == 0 ? 0.0 : (double) hits / lookups();
    }
}
