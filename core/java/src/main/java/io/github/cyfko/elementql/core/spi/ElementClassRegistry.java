package io.github.cyfko.elementql.core.spi;

import java.util.Optional;

/**
 * Lookup of element model classes by simple name.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ElementClassRegistry {

    /**
     * @param name simple class name, e.g. {@code "WallType"}
     * @return the class, or empty if the namespace has no such element class
     */
    Optional<Class<?>> byName(String name);
}
