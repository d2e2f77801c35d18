package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.api.RuleComparator;
import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.FilterRule;
import io.github.cyfko.elementql.core.spi.RuleOperand;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;

import java.util.Objects;

/**
 * {@link FilterRule} translated to a predicate over one stored {@link ParameterValue}.
 *
 * @since 1.0.0
 */
public final class JpaFilterRule implements FilterRule {

    /**
     * Condition on the value of the parameter a rule targets.
     */
    @FunctionalInterface
    interface ValueCondition {
        Predicate apply(CriteriaBuilder cb, Path<ParameterValue> value);
    }

    private final ParameterId parameter;
    private final RuleComparator comparator;
    private final RuleOperand operand;
    private final ValueCondition condition;

    JpaFilterRule(ParameterId parameter, RuleComparator comparator, RuleOperand operand, ValueCondition condition) {
        this.parameter = Objects.requireNonNull(parameter, "parameter cannot be null");
        this.comparator = Objects.requireNonNull(comparator, "comparator cannot be null");
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
        this.condition = Objects.requireNonNull(condition, "condition cannot be null");
    }

    ValueCondition condition() {
        return condition;
    }

    public ParameterId getParameter() {
        return parameter;
    }

    public RuleComparator getComparator() {
        return comparator;
    }

    public RuleOperand getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return parameter.name() + " " + comparator.key() + " " + operand;
    }
}
