package com.object.spatial.error;

/**
 * Raised when a joined flow task failed, was interrupted, or did not finish in time.
 */
public class FlowTaskException extends ObjectSpatialException {

    public FlowTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
