package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.spi.ElementClassRegistry;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;

import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ElementClassRegistry} resolving names against the managed element entities.
 * <p>
 * A name matches an entity whose entity name or simple class name equals it, provided the
 * entity extends {@link ElementEntity}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaEntityClassRegistry implements ElementClassRegistry {

    private final Metamodel metamodel;

    public JpaEntityClassRegistry(Metamodel metamodel) {
        this.metamodel = Objects.requireNonNull(metamodel, "metamodel cannot be null");
    }

    @Override
    public Optional<Class<?>> byName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String trimmed = name.trim();
        for (EntityType<?> entity : metamodel.getEntities()) {
            Class<?> javaType = entity.getJavaType();
            if (!ElementEntity.class.isAssignableFrom(javaType)) continue;
            if (trimmed.equals(entity.getName()) || trimmed.equals(javaType.getSimpleName())) {
                return Optional.of(javaType);
            }
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} if {@code type} is a concrete, managed subclass of {@link ElementEntity}
     */
    boolean isElementEntity(Class<?> type) {
        if (!ElementEntity.class.isAssignableFrom(type) || Modifier.isAbstract(type.getModifiers())) return false;
        for (EntityType<?> entity : metamodel.getEntities()) {
            if (entity.getJavaType() == type) return true;
        }
        return false;
    }
}
