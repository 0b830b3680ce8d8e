package com.object.spatial.core.model;

/**
 * The three families of archetypes an object-spatial program declares.
 */
public enum ArchetypeKind {
    NODE,
    EDGE,
    WALKER
}
