package com.object.spatial.core.model;

import java.util.Objects;

/**
 * Declared field of an archetype ({@code has} clause).
 *
 * @param name         field name
 * @param required     whether a value must be supplied at instantiation
 * @param defaultValue value used when optional and not supplied (may be null)
 */
public record FieldSpec(String name, boolean required, Object defaultValue) {

    public FieldSpec {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("required field '" + name + "' cannot declare a default");
        }
    }

    public static FieldSpec required(String name) {
        return new FieldSpec(name, true, null);
    }

    public static FieldSpec optional(String name, Object defaultValue) {
        return new FieldSpec(name, false, defaultValue);
    }
}
