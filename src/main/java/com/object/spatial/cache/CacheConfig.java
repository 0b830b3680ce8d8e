package com.object.spatial.cache;

/**
 * Configuration for the ability resolution cache.
 *
 * @param maxSize maximum number of (archetype, phase) entries
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,024 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_024, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
