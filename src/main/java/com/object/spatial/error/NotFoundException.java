package com.object.spatial.error;

import com.object.spatial.core.model.ElementId;

/**
 * Raised when a handle refers to an element that does not exist or was deleted.
 */
public class NotFoundException extends ObjectSpatialException {

    private final ElementId elementId;

    public NotFoundException(ElementId elementId) {
        super("Element not found: " + elementId);
        this.elementId = elementId;
    }

    public ElementId getElementId() {
        return elementId;
    }
}
