package io.github.cyfko.elementql.core.chain;

import io.github.cyfko.elementql.core.api.Criterion;

import java.util.Objects;

/**
 * A criterion together with the canonical value the query engine expects.
 * <p>
 * Produced by {@link CriteriaCoercion}: identifiers are resolved and typed
 * ({@code Class} for {@link Criterion#OF_CLASS}, {@code CategoryId} for
 * {@link Criterion#OF_CATEGORY}), toggles are {@code Boolean} and rules are
 * {@code ParameterRule}.
 * </p>
 *
 * @param criterion the criterion
 * @param value     canonical value
 * @since 1.0.0
 */
public record ResolvedCriterion(Criterion criterion, Object value) {

    public ResolvedCriterion {
        Objects.requireNonNull(criterion, "criterion cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
