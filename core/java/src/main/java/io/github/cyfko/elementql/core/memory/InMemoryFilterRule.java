package io.github.cyfko.elementql.core.memory;

import io.github.cyfko.elementql.core.api.RuleComparator;
import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.FilterRule;
import io.github.cyfko.elementql.core.spi.RuleOperand;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Compiled parameter comparison of the in-memory engine. Created by {@link InMemoryRuleFactory}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InMemoryFilterRule implements FilterRule {

    private final ParameterId parameter;
    private final RuleComparator comparator;
    private final RuleOperand operand;
    private final Predicate<Object> test;

    InMemoryFilterRule(ParameterId parameter, RuleComparator comparator, RuleOperand operand, Predicate<Object> test) {
        this.parameter = parameter;
        this.comparator = comparator;
        this.operand = operand;
        this.test = test;
    }

    /**
     * @return {@code false} when the element lacks the parameter
     */
    boolean matches(MemoryElement element) {
        Optional<Object> value = element.parameter(parameter.name());
        return value.isPresent() && test.test(value.get());
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
