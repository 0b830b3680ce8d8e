package com.object.spatial.error;

/**
 * Raised when an archetype of the wrong kind is used, or an edge type
 * does not allow the endpoint types it is asked to join.
 */
public class TypeMismatchException extends ObjectSpatialException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
