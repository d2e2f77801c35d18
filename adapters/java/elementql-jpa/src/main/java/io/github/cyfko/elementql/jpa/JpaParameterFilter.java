package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.spi.ElementFilter;
import jakarta.persistence.criteria.MapJoin;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;

import java.util.Objects;

/**
 * {@link ElementFilter} keeping the elements whose parameter satisfies a {@link JpaFilterRule}.
 * <p>
 * The rule runs in a subquery over the parameter table, so an element lacking the parameter
 * never passes the plain filter and always passes the inverted one.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaParameterFilter implements ElementFilter {

    private final JpaFilterRule rule;
    private final boolean inverted;

    JpaParameterFilter(JpaFilterRule rule, boolean inverted) {
        this.rule = Objects.requireNonNull(rule, "rule cannot be null");
        this.inverted = inverted;
    }

    /**
     * @return a resolver restricting the query root to the elements passing this filter
     */
    PredicateResolver<ElementEntity> toResolver() {
        return (root, query, cb) -> {
            Subquery<Long> matching = query.subquery(Long.class);
            Root<ElementEntity> candidate = matching.from(ElementEntity.class);
            MapJoin<ElementEntity, String, ParameterValue> parameter = candidate.joinMap("parameters");
            matching.select(candidate.get("id"))
                    .where(cb.equal(parameter.key(), rule.getParameter().name()),
                            rule.condition().apply(cb, parameter.value()));

            Predicate passes = root.get("id").in(matching);
            return inverted ? cb.not(passes) : passes;
        };
    }

    public JpaFilterRule getRule() {
        return rule;
    }

    public boolean isInverted() {
        return inverted;
    }

    @Override
    public String toString() {
        return inverted ? "NOT(" + rule + ")" : "(" + rule + ")";
    }
}
