package io.github.cyfko.elementql.core.spi;

import io.github.cyfko.elementql.core.model.ParameterId;

/**
 * Engine-side factory of parameter comparison rules.
 * <p>
 * One construction operation exists per comparator. Each takes the parameter identifier and
 * a {@link RuleOperand} carrying the comparator-specific modifiers (case-sensitivity for
 * text, tolerance for floating-point values) and returns an opaque {@link FilterRule}.
 * {@link #createParameterFilter(FilterRule, boolean)} then wraps a rule into the
 * {@link ElementFilter} consumed by {@link QueryHandle#wherePasses(ElementFilter)}.
 * </p>
 *
 * <p>
 * Implementations may reject operand shapes they do not support for a comparator (for
 * instance a numeric operand for {@code contains}) by throwing
 * {@link IllegalArgumentException}; the core propagates such errors unchanged.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterRuleFactory {

    FilterRule createEqualsRule(ParameterId parameter, RuleOperand operand);

    FilterRule createContainsRule(ParameterId parameter, RuleOperand operand);

    FilterRule createBeginsWithRule(ParameterId parameter, RuleOperand operand);

    FilterRule createEndsWithRule(ParameterId parameter, RuleOperand operand);

    FilterRule createGreaterRule(ParameterId parameter, RuleOperand operand);

    FilterRule createGreaterOrEqualRule(ParameterId parameter, RuleOperand operand);

    FilterRule createLessRule(ParameterId parameter, RuleOperand operand);

    FilterRule createLessOrEqualRule(ParameterId parameter, RuleOperand operand);

    /**
     * Wraps a rule into an element filter.
     *
     * @param rule     a rule created by this factory
     * @param inverted {@code true} to accept exactly the elements the rule rejects
     * @return the filter to pass to {@link QueryHandle#wherePasses(ElementFilter)}
     * @throws IllegalArgumentException if {@code rule} was not created by this factory
     */
    ElementFilter createParameterFilter(FilterRule rule, boolean inverted);
}
