package com.object.spatial.walker;

/**
 * How a walker reached {@link WalkerState#DONE}.
 */
public enum WalkerOutcome {
    /** Queue and pending-exit stack drained. */
    COMPLETED,
    /** Stopped by {@code disengage()}. */
    DISENGAGED,
    /** An ability or filter threw. */
    FAILED
}
