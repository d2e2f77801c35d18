package io.github.cyfko.elementql.core.memory;

import io.github.cyfko.elementql.core.api.RuleComparator;
import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.DoubleOperand;
import io.github.cyfko.elementql.core.spi.ElementFilter;
import io.github.cyfko.elementql.core.spi.FilterRule;
import io.github.cyfko.elementql.core.spi.FilterRuleFactory;
import io.github.cyfko.elementql.core.spi.IntegerOperand;
import io.github.cyfko.elementql.core.spi.RuleOperand;
import io.github.cyfko.elementql.core.spi.StringOperand;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * {@link FilterRuleFactory} of the in-memory engine.
 *
 * <h2>Comparison semantics</h2>
 * <ul>
 *   <li>Text operands only match text values. {@code equals}, {@code greater} and {@code less}
 *       compare lexicographically, {@code contains}, {@code begins} and {@code ends} by substring.
 *       Case-insensitive operands compare lower-cased values.</li>
 *   <li>Integer operands compare exactly with numeric values.</li>
 *   <li>Floating-point operands with tolerance {@code t}: {@code equals} holds when
 *       {@code |a - b| <= t}, {@code greater} when {@code a > b + t}, {@code greater_equal} when
 *       {@code a >= b - t}, {@code less} when {@code a < b - t} and {@code less_equal} when
 *       {@code a <= b + t}.</li>
 * </ul>
 * <p>
 * {@code contains}, {@code begins} and {@code ends} reject non-text operands with an
 * {@link IllegalArgumentException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InMemoryRuleFactory implements FilterRuleFactory {

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
        if (!(rule instanceof InMemoryFilterRule memoryRule)) {
            throw new IllegalArgumentException("Not an in-memory rule: " + rule);
        }
        return new InMemoryParameterFilter(memoryRule, inverted);
    }

    private static InMemoryFilterRule rule(ParameterId parameter, RuleComparator comparator, RuleOperand operand) {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        Objects.requireNonNull(operand, "operand cannot be null");

        Predicate<Object> test;
        if (operand instanceof StringOperand text) {
            test = textTest(comparator, text);
        } else if (comparator.isTextOnly()) {
            throw new IllegalArgumentException("Comparator " + comparator.key() + " requires a text operand, got " + operand);
        } else if (operand instanceof IntegerOperand integer) {
            test = integerTest(comparator, integer.value());
        } else if (operand instanceof DoubleOperand number) {
            test = doubleTest(comparator, number.value(), number.tolerance());
        } else {
            throw new IllegalArgumentException("Unsupported operand " + operand.getClass().getName());
        }
        return new InMemoryFilterRule(parameter, comparator, operand, test);
    }

    private static Predicate<Object> textTest(RuleComparator comparator, StringOperand operand) {
        boolean caseSensitive = operand.caseSensitive();
        String expected = caseSensitive ? operand.value() : operand.value().toLowerCase(Locale.ROOT);
        return actual -> {
            if (!(actual instanceof String text)) return false;
            String value = caseSensitive ? text : text.toLowerCase(Locale.ROOT);
            return switch (comparator) {
                case CONTAINS -> value.contains(expected);
                case BEGINS -> value.startsWith(expected);
                case ENDS -> value.endsWith(expected);
                default -> holds(comparator, value.compareTo(expected));
            };
        };
    }

    private static Predicate<Object> integerTest(RuleComparator comparator, long expected) {
        return actual -> {
            if (actual instanceof Long value) return holds(comparator, Long.compare(value, expected));
            if (!(actual instanceof Number number)) return false;
            double value = number.doubleValue();
            // NaN matches nothing and -0.0 equals 0
            if (Double.isNaN(value)) return false;
            return holds(comparator, value < expected ? -1 : value > expected ? 1 : 0);
        };
    }

    private static Predicate<Object> doubleTest(RuleComparator comparator, double expected, double tolerance) {
        return actual -> {
            if (!(actual instanceof Number number)) return false;
            double value = number.doubleValue();
            return switch (comparator) {
                case EQUALS -> Math.abs(value - expected) <= tolerance;
                case GREATER -> value > expected + tolerance;
                case GREATER_EQUAL -> value >= expected - tolerance;
                case LESS -> value < expected - tolerance;
                case LESS_EQUAL -> value <= expected + tolerance;
                default -> throw new IllegalStateException("Unexpected comparator " + comparator);
            };
        };
    }

    private static boolean holds(RuleComparator comparator, int comparison) {
        return switch (comparator) {
            case EQUALS -> comparison == 0;
            case GREATER -> comparison > 0;
            case GREATER_EQUAL -> comparison >= 0;
            case LESS -> comparison < 0;
            case LESS_EQUAL -> comparison <= 0;
            default -> throw new IllegalStateException("Unexpected comparator " + comparator);
        };
    }
}
