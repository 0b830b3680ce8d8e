package com.object.spatial.error;

/**
 * Raised when a visit filter predicate throws while being evaluated.
 */
public class FilterEvaluationException extends ObjectSpatialException {

    public FilterEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
