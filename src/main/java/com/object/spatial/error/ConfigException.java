package com.object.spatial.error;

/**
 * Raised when a walker is spawned with missing or unknown fields, or with no targets.
 */
public class ConfigException extends ObjectSpatialException {

    public ConfigException(String message) {
        super(message);
    }
}
