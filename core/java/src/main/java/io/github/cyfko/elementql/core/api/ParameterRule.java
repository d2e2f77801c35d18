package io.github.cyfko.elementql.core.api;

import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.ElementFilter;

import java.util.Objects;

/**
 * Immutable description of a single parameter-value comparison, compiled into an engine
 * {@link ElementFilter}.
 * <p>
 * Rules are created by {@link io.github.cyfko.elementql.core.rule.RuleBuilder}, which asks
 * the store's rule factory for the filter at construction time. The filter chain only ever
 * uses {@link #filter()}; the remaining fields describe the rule for diagnostics.
 * </p>
 *
 * <pre>{@code
 * ParameterRule tall = rules.parameter("Height").greater(10.0).build();
 * collector.filter(Criteria.builder().parameterFilter(tall).build());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParameterRule {

    private final ParameterId parameterId;
    private final RuleComparator comparator;
    private final Object value;
    private final boolean caseSensitive;
    private final double precision;
    private final boolean negated;
    private final ElementFilter filter;

    /**
     * @param parameterId   compared parameter
     * @param comparator    the single active comparator
     * @param value         comparison operand (text, integer or floating-point)
     * @param caseSensitive case-sensitivity, meaningful for text operands only
     * @param precision     tolerance, meaningful for floating-point operands only
     * @param negated       whether the match sense is inverted
     * @param filter        engine filter compiled from the fields above
     */
    public ParameterRule(ParameterId parameterId,
                         RuleComparator comparator,
                         Object value,
                         boolean caseSensitive,
                         double precision,
                         boolean negated,
                         ElementFilter filter) {
        this.parameterId = Objects.requireNonNull(parameterId, "parameterId cannot be null");
        this.comparator = Objects.requireNonNull(comparator, "comparator cannot be null");
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.caseSensitive = caseSensitive;
        this.precision = precision;
        this.negated = negated;
        this.filter = Objects.requireNonNull(filter, "filter cannot be null");
    }

    public ParameterId parameterId() {
        return parameterId;
    }

    public RuleComparator comparator() {
        return comparator;
    }

    public Object value() {
        return value;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    public double precision() {
        return precision;
    }

    public boolean negated() {
        return negated;
    }

    /**
     * @return the opaque engine filter this rule compiles to
     */
    public ElementFilter filter() {
        return filter;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ParameterRule{")
                .append(parameterId.name()).append(": ")
                .append(comparator.key()).append('=').append(value instanceof String ? "'" + value + "'" : value);
        if (value instanceof String) sb.append(", case_sensitive=").append(caseSensitive);
        if (value instanceof Double || value instanceof Float) sb.append(", precision=").append(precision);
        if (negated) sb.append(", negated");
        return sb.append('}').toString();
    }
}
