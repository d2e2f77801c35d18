package io.github.cyfko.elementql.core.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Value of an identifier-valued criterion: either an already resolved identifier or a
 * human-friendly shorthand name still to be resolved.
 * <p>
 * Instances are immutable. The shorthand form is resolved exactly once, by
 * {@link io.github.cyfko.elementql.core.chain.CriteriaCoercion}; nothing downstream ever
 * sees a name.
 * </p>
 *
 * <pre>{@code
 * Identifier<CategoryId> resolved = Identifier.of(CategoryId.of(-2000011));
 * Identifier<CategoryId> named = Identifier.named("Walls");
 * }</pre>
 *
 * @param <T> the canonical identifier type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Identifier<T> {

    private final T value;
    private final String name;

    private Identifier(T value, String name) {
        this.value = value;
        this.name = name;
    }

    /**
     * @param value resolved identifier, not {@code null}
     * @return an identifier holding {@code value}
     */
    public static <T> Identifier<T> of(T value) {
        return new Identifier<>(Objects.requireNonNull(value, "identifier value cannot be null"), null);
    }

    /**
     * @param name shorthand name, not blank
     * @return an identifier still to be resolved by name
     */
    public static <T> Identifier<T> named(String name) {
        Objects.requireNonNull(name, "identifier name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("identifier name cannot be blank");
        }
        return new Identifier<>(null, name);
    }

    public boolean isNamed() {
        return name != null;
    }

    /**
     * @return the shorthand name, empty for a resolved identifier
     */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /**
     * @return the resolved identifier, empty for a shorthand name
     */
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier<?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, name);
    }

    @Override
    public String toString() {
        return isNamed() ? "'" + name + "'" : String.valueOf(value);
    }
}
