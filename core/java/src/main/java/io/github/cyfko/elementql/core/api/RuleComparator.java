package io.github.cyfko.elementql.core.api;

import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.FilterRule;
import io.github.cyfko.elementql.core.spi.FilterRuleFactory;
import io.github.cyfko.elementql.core.spi.RuleOperand;

import java.util.Optional;

/**
 * Enumeration of the comparators a {@link ParameterRule} may use.
 * <p>
 * Each comparator knows its condition key and which {@link FilterRuleFactory} operation
 * builds it.
 * </p>
 *
 * <p><em>Comparisons and their factory operations:</em></p>
 * <pre>{@code
 * param == value              -> EQUALS         -> createEqualsRule
 * param contains 'abc'        -> CONTAINS       -> createContainsRule
 * param starts with 'abc'     -> BEGINS         -> createBeginsWithRule
 * param ends with 'abc'       -> ENDS           -> createEndsWithRule
 * param > value               -> GREATER        -> createGreaterRule
 * param >= value              -> GREATER_EQUAL  -> createGreaterOrEqualRule
 * param < value               -> LESS           -> createLessRule
 * param <= value              -> LESS_EQUAL     -> createLessOrEqualRule
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum RuleComparator {

    EQUALS("equals"),
    CONTAINS("contains"),
    BEGINS("begins"),
    ENDS("ends"),
    GREATER("greater"),
    GREATER_EQUAL("greater_equal"),
    LESS("less"),
    LESS_EQUAL("less_equal");

    private final String key;

    RuleComparator(String key) {
        this.key = key;
    }

    /**
     * @return the condition key, e.g. {@code "greater_equal"}
     */
    public String key() {
        return key;
    }

    /**
     * Indicates whether this comparator only makes sense for text operands.
     *
     * @return {@code true} for {@link #CONTAINS}, {@link #BEGINS} and {@link #ENDS}
     */
    public boolean isTextOnly() {
        return this == CONTAINS || this == BEGINS || this == ENDS;
    }

    /**
     * Builds the low-level rule for this comparator through the matching factory operation.
     *
     * @param factory   engine rule factory
     * @param parameter compared parameter
     * @param operand   comparison operand with its modifiers
     * @return the engine rule
     */
    public FilterRule create(FilterRuleFactory factory, ParameterId parameter, RuleOperand operand) {
        return switch (this) {
            case EQUALS -> factory.createEqualsRule(parameter, operand);
            case CONTAINS -> factory.createContainsRule(parameter, operand);
            case BEGINS -> factory.createBeginsWithRule(parameter, operand);
            case ENDS -> factory.createEndsWithRule(parameter, operand);
            case GREATER -> factory.createGreaterRule(parameter, operand);
            case GREATER_EQUAL -> factory.createGreaterOrEqualRule(parameter, operand);
            case LESS -> factory.createLessRule(parameter, operand);
            case LESS_EQUAL -> factory.createLessOrEqualRule(parameter, operand);
        };
    }

    /**
     * Finds a comparator by its condition key.
     *
     * @param key condition key
     * @return the comparator, or empty if {@code key} is not a comparator key
     */
    public static Optional<RuleComparator> fromKey(String key) {
        if (key == null) return Optional.empty();
        for (RuleComparator comparator : values()) {
            if (comparator.key.equals(key)) return Optional.of(comparator);
        }
        return Optional.empty();
    }
}
