package io.github.cyfko.elementql.core.chain;

import io.github.cyfko.elementql.core.api.Criteria;
import io.github.cyfko.elementql.core.api.Criterion;
import io.github.cyfko.elementql.core.api.Identifier;
import io.github.cyfko.elementql.core.exception.CriterionValueException;
import io.github.cyfko.elementql.core.exception.UnknownIdentifierException;
import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.spi.CategoryRegistry;
import io.github.cyfko.elementql.core.spi.ElementClassRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves human-friendly shorthands in {@link Criteria} into the identifiers the query engine
 * requires.
 * <p>
 * Category names are looked up in a {@link CategoryRegistry}, class names in an
 * {@link ElementClassRegistry}. Already resolved identifiers pass through after a type check,
 * toggles and rules pass through untouched. The step is pure: the input criteria are never
 * modified and the registries are only read.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * CriteriaCoercion coercion = new CriteriaCoercion(store.categories(), store.classes());
 * List<ResolvedCriterion> resolved = coercion.coerce(
 *     Criteria.builder().ofCategory("Walls").ofClass("WallType").build());
 * // [ResolvedCriterion[OF_CATEGORY, CategoryId[-2000011]], ResolvedCriterion[OF_CLASS, class WallType]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CriteriaCoercion {

    private final CategoryRegistry categories;
    private final ElementClassRegistry classes;

    public CriteriaCoercion(CategoryRegistry categories, ElementClassRegistry classes) {
        this.categories = Objects.requireNonNull(categories, "categories cannot be null");
        this.classes = Objects.requireNonNull(classes, "classes cannot be null");
    }

    /**
     * Resolves every criterion, keeping the criteria order.
     *
     * @param criteria criteria to resolve
     * @return resolved criteria, unmodifiable
     * @throws UnknownIdentifierException if a shorthand cannot be resolved
     * @throws CriterionValueException    if an identifier has the wrong type
     */
    public List<ResolvedCriterion> coerce(Criteria criteria) {
        Objects.requireNonNull(criteria, "criteria cannot be null");
        List<ResolvedCriterion> resolved = new ArrayList<>(criteria.size());
        for (Map.Entry<Criterion, Object> entry : criteria.asMap().entrySet()) {
            Criterion criterion = entry.getKey();
            Object value = switch (criterion) {
                case OF_CATEGORY -> resolve(criterion, entry.getValue(), CategoryId.class, categories::byName);
                case OF_CLASS -> resolve(criterion, entry.getValue(), Class.class, classes::byName);
                default -> entry.getValue();
            };
            resolved.add(new ResolvedCriterion(criterion, value));
        }
        return Collections.unmodifiableList(resolved);
    }

    private static Object resolve(Criterion criterion,
                                  Object value,
                                  Class<?> expectedType,
                                  Function<String, Optional<?>> lookup) {
        Identifier<?> identifier = (Identifier<?>) value;
        if (identifier.isNamed()) {
            String name = identifier.name().orElseThrow();
            Optional<?> found = lookup.apply(name);
            if (found.isEmpty()) {
                throw new UnknownIdentifierException(criterion, name);
            }
            return found.get();
        }

        Object resolved = identifier.value().orElseThrow();
        if (!expectedType.isInstance(resolved)) {
            throw new CriterionValueException(String.format(
                    "Criterion %s expects a %s or a name, got %s",
                    criterion.key(), expectedType.getSimpleName(), resolved.getClass().getSimpleName()));
        }
        return resolved;
    }
}
