package io.github.cyfko.elementql.core.model;

/**
 * Canonical identifier of an element category (walls, doors, views, ...).
 * <p>
 * This is the form the query engine expects for the {@code of_category} criterion.
 * Human-readable category names are resolved into a {@code CategoryId} through a
 * {@link io.github.cyfko.elementql.core.spi.CategoryRegistry}.
 * </p>
 *
 * @param value the raw identifier value
 * @since 1.0.0
 */
public record CategoryId(long value) {

    public static CategoryId of(long value) {
        return new CategoryId(value);
    }
}
