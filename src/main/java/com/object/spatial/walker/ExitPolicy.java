package com.object.spatial.walker;

/**
 * How often exit abilities fire for an element entered more than once in one run.
 */
public enum ExitPolicy {
    /** Exits fire once per element per run, when its first entry completes. */
    ONCE_PER_NODE,
    /** Every entry is paired with its own exit. */
    ONCE_PER_VISIT
}
