package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.api.RuleComparator;
import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.DoubleOperand;
import io.github.cyfko.elementql.core.spi.ElementFilter;
import io.github.cyfko.elementql.core.spi.FilterRule;
import io.github.cyfko.elementql.core.spi.FilterRuleFactory;
import io.github.cyfko.elementql.core.spi.IntegerOperand;
import io.github.cyfko.elementql.core.spi.RuleOperand;
import io.github.cyfko.elementql.core.spi.StringOperand;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;

import java.util.Locale;
import java.util.Objects;

/**
 * {@link FilterRuleFactory} producing Criteria API rules over {@link ParameterValue} columns.
 * <p>
 * Comparisons follow the in-memory engine: text operands test {@code text_value}, numeric
 * operands test both {@code integer_value} and {@code double_value}. Floating-point operands
 * widen the bounds by their tolerance; against integer columns the widened bounds are rounded
 * inwards, which is exact for integral values.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaFilterRuleFactory implements FilterRuleFactory {

    private static final char ESCAPE = '\\';

    @Override
    public FilterRule createEqualsRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.EQUALS, operand);
    }

    @Override
    public FilterRule createContainsRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.CONTAINS, operand);
    }

    @Override
    public FilterRule createBeginsWithRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.BEGINS, operand);
    }

    @Override
    public FilterRule createEndsWithRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.ENDS, operand);
    }

    @Override
    public FilterRule createGreaterRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.GREATER, operand);
    }

    @Override
    public FilterRule createGreaterOrEqualRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.GREATER_EQUAL, operand);
    }

    @Override
    public FilterRule createLessRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.LESS, operand);
    }

    @Override
    public FilterRule createLessOrEqualRule(ParameterId parameter, RuleOperand operand) {
        return rule(parameter, RuleComparator.LESS_EQUAL, operand);
    }

    @Override
    public ElementFilter createParameterFilter(FilterRule rule, boolean inverted) {
        if (!(rule instanceof JpaFilterRule jpaRule)) {
            throw new IllegalArgumentException("Not a JPA rule: " + rule);
        }
        return new JpaParameterFilter(jpaRule, inverted);
    }

    private static JpaFilterRule rule(ParameterId parameter, RuleComparator comparator, RuleOperand operand) {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        Objects.requireNonNull(operand, "operand cannot be null");

        JpaFilterRule.ValueCondition condition;
        if (operand instanceof StringOperand text) {
            condition = textCondition(comparator, text);
        } else if (comparator.isTextOnly()) {
            throw new IllegalArgumentException("Comparator " + comparator.key() + " requires a text operand, got " + operand);
        } else if (operand instanceof IntegerOperand integer) {
            long b = integer.value();
            condition = (cb, value) -> cb.or(
                    range(cb, value.<Long>get("integerValue"), comparator, b, b),
                    range(cb, value.<Double>get("doubleValue"), comparator, (double) b, (double) b));
        } else if (operand instanceof DoubleOperand number) {
            double lower = number.value() - number.tolerance();
            double upper = number.value() + number.tolerance();
            condition = (cb, value) -> cb.or(
                    range(cb, value.<Double>get("doubleValue"), comparator, lower, upper),
                    range(cb, value.<Long>get("integerValue"), comparator, (long) Math.ceil(lower), (long) Math.floor(upper)));
        } else {
            throw new IllegalArgumentException("Unsupported operand " + operand.getClass().getName());
        }
        return new JpaFilterRule(parameter, comparator, operand, condition);
    }

    private static JpaFilterRule.ValueCondition textCondition(RuleComparator comparator, StringOperand operand) {
        boolean caseSensitive = operand.caseSensitive();
        String expected = caseSensitive ? operand.value() : operand.value().toLowerCase(Locale.ROOT);
        return (cb, value) -> {
            Path<String> column = value.get("textValue");
            Expression<String> text = caseSensitive ? column : cb.lower(column);
            return switch (comparator) {
                case EQUALS -> cb.equal(text, expected);
                case GREATER -> cb.greaterThan(text, expected);
                case GREATER_EQUAL -> cb.greaterThanOrEqualTo(text, expected);
                case LESS -> cb.lessThan(text, expected);
                case LESS_EQUAL -> cb.lessThanOrEqualTo(text, expected);
                case CONTAINS -> cb.like(text, "%" + escapeLike(expected) + "%", ESCAPE);
                case BEGINS -> cb.like(text, escapeLike(expected) + "%", ESCAPE);
                case ENDS -> cb.like(text, "%" + escapeLike(expected), ESCAPE);
            };
        };
    }

    /**
     * Builds the comparison of {@code x} against the closed interval {@code [lower, upper]}:
     * equality means inside it, {@code greater} above it, {@code less} below it.
     */
    private static <N extends Number & Comparable<? super N>> Predicate range(CriteriaBuilder cb, Expression<N> x,
                                                                              RuleComparator comparator, N lower, N upper) {
        return switch (comparator) {
            case EQUALS -> cb.and(cb.greaterThanOrEqualTo(x, lower), cb.lessThanOrEqualTo(x, upper));
            case GREATER -> cb.greaterThan(x, upper);
            case GREATER_EQUAL -> cb.greaterThanOrEqualTo(x, lower);
            case LESS -> cb.lessThan(x, lower);
            case LESS_EQUAL -> cb.lessThanOrEqualTo(x, upper);
            default -> throw new IllegalStateException("Unexpected comparator " + comparator);
        };
    }

    private static String escapeLike(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '%' || c == '_' || c == ESCAPE) sb.append(ESCAPE);
            sb.append(c);
        }
        return sb.toString();
    }
}
