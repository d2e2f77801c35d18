package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.spi.CategoryRegistry;
import jakarta.persistence.EntityManager;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link CategoryRegistry} reading {@link CategoryEntity} rows. Names are matched exactly after
 * trimming.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaCategoryRegistry implements CategoryRegistry {

    private final EntityManager em;

    public JpaCategoryRegistry(EntityManager em) {
        this.em = Objects.requireNonNull(em, "entityManager cannot be null");
    }

    @Override
    public Optional<CategoryId> byName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        CategoryEntity category = em.find(CategoryEntity.class, name.trim());
        return category == null ? Optional.empty() : Optional.of(category.getCategory());
    }
}
