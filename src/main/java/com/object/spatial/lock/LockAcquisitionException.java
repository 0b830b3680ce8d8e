package com.object.spatial.lock;

import com.object.spatial.error.ObjectSpatialException;

/**
 * Runtime exception thrown when a partition lock cannot be acquired
 * within the configured timeout.
 */
public class LockAcquisitionException extends ObjectSpatialException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
