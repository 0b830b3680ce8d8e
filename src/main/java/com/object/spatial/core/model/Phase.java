package com.object.spatial.core.model;

/**
 * When an ability fires relative to a walker's arrival at an element.
 */
public enum Phase {
    ENTRY,
    EXIT
}
