package com.object.spatial.error;

/**
 * Base class of every exception raised by the object-spatial runtime.
 */
public class ObjectSpatialException extends RuntimeException {

    public ObjectSpatialException(String message) {
        super(message);
    }

    public ObjectSpatialException(String message, Throwable cause) {
        super(message, cause);
    }
}
