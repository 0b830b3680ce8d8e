package com.object.spatial.lock;

/**
 * Configuration for partition locking.
 *
 * @param timeoutMs maximum time to wait for a partition lock
 * @param fair      whether partition locks grant access in arrival order
 */
public record LockConfig(long timeoutMs, boolean fair) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, non-fair locks.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, false);
    }
}
