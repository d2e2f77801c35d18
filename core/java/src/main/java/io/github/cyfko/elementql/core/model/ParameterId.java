package io.github.cyfko.elementql.core.model;

import java.util.Objects;

/**
 * Identifier of an element parameter ("Height", "Type Name", "Mark", ...).
 *
 * @param name parameter name, never blank
 * @since 1.0.0
 */
public record ParameterId(String name) {

    public ParameterId {
        Objects.requireNonNull(name, "parameter name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("parameter name cannot be blank");
        }
    }

    public static ParameterId of(String name) {
        return new ParameterId(name);
    }
}
