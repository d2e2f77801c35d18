package io.github.cyfko.elementql.core.spi;

import io.github.cyfko.elementql.core.model.CategoryId;

import java.util.Optional;

/**
 * Lookup of category identifiers by human-readable name.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface CategoryRegistry {

    /**
     * @param name category name, e.g. {@code "Walls"}
     * @return the category identifier, or empty if the name is unknown
     */
    Optional<CategoryId> byName(String name);
}
