package com.object.spatial.core.model;

/**
 * Access a root grants to another root over its partition.
 * Levels are ordered; a higher level implies every lower one.
 */
public enum AccessLevel {
    NO_ACCESS,
    READ,
    CONNECT,
    WRITE;

    public boolean allows(AccessLevel required) {
        return compareTo(required) >= 0;
    }
}
