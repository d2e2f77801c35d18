package io.github.cyfko.elementql.core.registry;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.spi.CategoryRegistry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link CategoryRegistry}.
 * <p>
 * Names are matched exactly after trimming. Several names may point to the same
 * {@link CategoryId}, which allows aliases such as {@code "Walls"} and {@code "OST_Walls"}.
 * Registering a name a second time for a different category is rejected.
 * </p>
 *
 * <p><strong>Concurrency:</strong> backed by a {@link ConcurrentHashMap}; registration and
 * lookup may happen from different threads.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * MapCategoryRegistry categories = new MapCategoryRegistry()
 *     .register("Walls", CategoryId.of(-2000011))
 *     .register("OST_Walls", CategoryId.of(-2000011))
 *     .register("Doors", CategoryId.of(-2000023));
 *
 * Optional<CategoryId> walls = categories.byName("Walls");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MapCategoryRegistry implements CategoryRegistry {

    private final Map<String, CategoryId> categories = new ConcurrentHashMap<>();

    /**
     * Registers a category under the given name.
     *
     * @param name     category name, not blank
     * @param category category identifier
     * @return this registry
     * @throws IllegalArgumentException if the name is blank or already bound to another category
     */
    public MapCategoryRegistry register(String name, CategoryId category) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(category, "category cannot be null");
        String key = name.trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Category name cannot be blank");
        }
        CategoryId previous = categories.putIfAbsent(key, category);
        if (previous != null && !previous.equals(category)) {
            throw new IllegalArgumentException("Category [" + key + "] is already registered as " + previous);
        }
        return this;
    }

    /**
     * Removes a name. Other aliases of the same category stay registered.
     *
     * @param name category name
     * @return {@code true} if the name was registered
     */
    public boolean unregister(String name) {
        if (name == null) return false;
        return categories.remove(name.trim()) != null;
    }

    @Override
    public Optional<CategoryId> byName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(categories.get(name.trim()));
    }

    /**
     * @return a sorted snapshot of the registered names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(categories.keySet()));
    }
}
