package io.github.cyfko.elementql.core.rule;

import io.github.cyfko.elementql.core.api.ParameterRule;
import io.github.cyfko.elementql.core.api.RuleComparator;
import io.github.cyfko.elementql.core.config.ElementQueryConfig;
import io.github.cyfko.elementql.core.config.UnknownConditionPolicy;
import io.github.cyfko.elementql.core.exception.RuleDefinitionException;
import io.github.cyfko.elementql.core.model.ParameterId;
import io.github.cyfko.elementql.core.spi.DoubleOperand;
import io.github.cyfko.elementql.core.spi.ElementFilter;
import io.github.cyfko.elementql.core.spi.FilterRule;
import io.github.cyfko.elementql.core.spi.FilterRuleFactory;
import io.github.cyfko.elementql.core.spi.IntegerOperand;
import io.github.cyfko.elementql.core.spi.RuleOperand;
import io.github.cyfko.elementql.core.spi.StringOperand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds {@link ParameterRule} instances from a parameter identifier and named conditions.
 * <p>
 * Conditions hold exactly one comparator key ({@code equals}, {@code contains}, {@code begins},
 * {@code ends}, {@code greater}, {@code greater_equal}, {@code less}, {@code less_equal}) and
 * optional modifiers:
 * </p>
 * <ul>
 *   <li>{@code case_sensitive} (boolean): applies to text operands, defaults to
 *       {@link ElementQueryConfig#isCaseSensitive()}</li>
 *   <li>{@code precision} (number): tolerance of floating-point operands, defaults to
 *       {@link ElementQueryConfig#getPrecision()}</li>
 *   <li>{@code negated} (boolean, alias {@code reverse}): inverts the match sense</li>
 * </ul>
 *
 * <p><strong>Operand mapping:</strong></p>
 * <ul>
 *   <li>{@code String} → {@link StringOperand} with the effective case-sensitivity</li>
 *   <li>{@code Integer}, {@code Long}, {@code Short}, {@code Byte} → {@link IntegerOperand}</li>
 *   <li>{@code Boolean} → {@link IntegerOperand} of {@code 1} or {@code 0} (yes/no parameters)</li>
 *   <li>{@code Double}, {@code Float} → {@link DoubleOperand} with the effective precision as tolerance</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * RuleBuilder rules = new RuleBuilder(store.ruleFactory());
 *
 * ParameterRule byName = rules.build(ParameterId.of("Type Name"), Map.of("equals", "Wall 1"));
 * ParameterRule tall = rules.parameter("Height").greater(10.0).build();
 * ParameterRule notGeneric = rules.parameter("Type Name")
 *     .contains("generic")
 *     .caseSensitive(false)
 *     .negated(true)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RuleBuilder {

    private static final Logger log = Logger.getLogger(RuleBuilder.class.getName());

    public static final String CASE_SENSITIVE = "case_sensitive";
    public static final String PRECISION = "precision";
    public static final String NEGATED = "negated";
    public static final String REVERSE = "reverse";

    private static final Set<String> MODIFIERS = Set.of(CASE_SENSITIVE, PRECISION, NEGATED, REVERSE);

    private final FilterRuleFactory factory;
    private final ElementQueryConfig config;

    /**
     * Creates a rule builder with {@link ElementQueryConfig#defaults()}.
     *
     * @param factory engine rule factory
     */
    public RuleBuilder(FilterRuleFactory factory) {
        this(factory, ElementQueryConfig.defaults());
    }

    /**
     * @param factory engine rule factory
     * @param config  defaults and policies
     */
    public RuleBuilder(FilterRuleFactory factory, ElementQueryConfig config) {
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Starts a fluent rule definition for the named parameter.
     */
    public Conditions parameter(String parameterName) {
        return new Conditions(ParameterId.of(parameterName));
    }

    /**
     * Starts a fluent rule definition for the given parameter.
     */
    public Conditions parameter(ParameterId parameter) {
        return new Conditions(Objects.requireNonNull(parameter, "parameter cannot be null"));
    }

    public ParameterRule build(String parameterName, Map<String, ?> conditions) {
        return build(ParameterId.of(parameterName), conditions);
    }

    /**
     * Builds a rule from named conditions.
     *
     * @param parameter  compared parameter
     * @param conditions one comparator key plus optional modifiers
     * @return the compiled rule
     * @throws RuleDefinitionException if the conditions do not describe exactly one valid comparison
     */
    public ParameterRule build(ParameterId parameter, Map<String, ?> conditions) {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        Objects.requireNonNull(conditions, "conditions cannot be null");

        boolean caseSensitive = booleanModifier(conditions, CASE_SENSITIVE, config.isCaseSensitive());
        boolean negated = conditions.containsKey(NEGATED)
                ? booleanModifier(conditions, NEGATED, false)
                : booleanModifier(conditions, REVERSE, false);
        double precision = precisionModifier(conditions);

        List<RuleComparator> comparators = new ArrayList<>();
        Object operandValue = null;
        for (Map.Entry<String, ?> entry : conditions.entrySet()) {
            String key = entry.getKey();
            var comparator = RuleComparator.fromKey(key);
            if (comparator.isPresent()) {
                comparators.add(comparator.get());
                operandValue = entry.getValue();
            } else if (!MODIFIERS.contains(key)) {
                onUnknownCondition(parameter, key);
            }
        }

        if (comparators.isEmpty()) {
            throw new RuleDefinitionException("No comparator given for parameter '" + parameter.name()
                    + "'. Expected one of " + comparatorKeys());
        }
        if (comparators.size() > 1) {
            throw new RuleDefinitionException("Exactly one comparator expected for parameter '" + parameter.name()
                    + "', got " + comparators.stream().map(RuleComparator::key).toList());
        }

        RuleComparator comparator = comparators.get(0);
        RuleOperand operand = toOperand(parameter, comparator, operandValue, caseSensitive, precision);

        log.fine(() -> String.format("Building %s rule on '%s' with %s (negated=%s)",
                comparator.key(), parameter.name(), operand, negated));

        FilterRule rule = comparator.create(factory, parameter, operand);
        ElementFilter filter = factory.createParameterFilter(rule, negated);
        return new ParameterRule(parameter, comparator, operandValue, caseSensitive, precision, negated, filter);
    }

    private void onUnknownCondition(ParameterId parameter, String key) {
        if (config.getUnknownConditionPolicy() == UnknownConditionPolicy.STRICT_EXCEPTION) {
            throw new RuleDefinitionException("Unknown condition '" + key + "' for parameter '" + parameter.name() + "'");
        }
        log.warning(() -> "Ignoring unknown condition '" + key + "' for parameter '" + parameter.name() + "'");
    }

    private static RuleOperand toOperand(ParameterId parameter,
                                         RuleComparator comparator,
                                         Object value,
                                         boolean caseSensitive,
                                         double precision) {
        if (value == null) {
            throw new RuleDefinitionException("Comparator " + comparator.key() + " on '" + parameter.name()
                    + "' requires a value");
        }
        if (value instanceof String text) {
            return new StringOperand(text, caseSensitive);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new IntegerOperand(((Number) value).longValue());
        }
        if (value instanceof Boolean flag) {
            return new IntegerOperand(flag ? 1L : 0L);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                throw new RuleDefinitionException("Comparator " + comparator.key() + " on '" + parameter.name()
                        + "' cannot compare with NaN");
            }
            return new DoubleOperand(number, precision);
        }
        throw new RuleDefinitionException(String.format(
                "Unsupported operand type %s for comparator %s on '%s'",
                value.getClass().getSimpleName(), comparator.key(), parameter.name()));
    }

    private static boolean booleanModifier(Map<String, ?> conditions, String key, boolean defaultValue) {
        Object value = conditions.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean flag) return flag;
        throw new RuleDefinitionException("Condition '" + key + "' expects a boolean, got "
                + value.getClass().getSimpleName());
    }

    private double precisionModifier(Map<String, ?> conditions) {
        Object value = conditions.get(PRECISION);
        if (value == null) return config.getPrecision();
        if (value instanceof Number number) {
            double precision = number.doubleValue();
            if (precision < 0 || Double.isNaN(precision) || Double.isInfinite(precision)) {
                throw new RuleDefinitionException("Condition 'precision' must be a finite, non-negative number, got " + value);
            }
            return precision;
        }
        throw new RuleDefinitionException("Condition 'precision' expects a number, got " + value.getClass().getSimpleName());
    }

    private static List<String> comparatorKeys() {
        List<String> keys = new ArrayList<>();
        for (RuleComparator comparator : RuleComparator.values()) {
            keys.add(comparator.key());
        }
        return keys;
    }

    /**
     * Fluent condition set for one parameter. Setting a second comparator makes
     * {@link #build()} fail, as with the map form.
     */
    public final class Conditions {
        private final ParameterId parameter;
        private final Map<String, Object> conditions = new LinkedHashMap<>();

        private Conditions(ParameterId parameter) {
            this.parameter = parameter;
        }

        public Conditions equalTo(Object value) {
            return comparator(RuleComparator.EQUALS, value);
        }

        public Conditions contains(String value) {
            return comparator(RuleComparator.CONTAINS, value);
        }

        public Conditions beginsWith(String value) {
            return comparator(RuleComparator.BEGINS, value);
        }

        public Conditions endsWith(String value) {
            return comparator(RuleComparator.ENDS, value);
        }

        public Conditions greater(Object value) {
            return comparator(RuleComparator.GREATER, value);
        }

        public Conditions greaterOrEqual(Object value) {
            return comparator(RuleComparator.GREATER_EQUAL, value);
        }

        public Conditions less(Object value) {
            return comparator(RuleComparator.LESS, value);
        }

        public Conditions lessOrEqual(Object value) {
            return comparator(RuleComparator.LESS_EQUAL, value);
        }

        public Conditions caseSensitive(boolean caseSensitive) {
            conditions.put(CASE_SENSITIVE, caseSensitive);
            return this;
        }

        public Conditions precision(double precision) {
            conditions.put(PRECISION, precision);
            return this;
        }

        public Conditions negated(boolean negated) {
            conditions.put(NEGATED, negated);
            return this;
        }

        public ParameterRule build() {
            return RuleBuilder.this.build(parameter, conditions);
        }

        private Conditions comparator(RuleComparator comparator, Object value) {
            conditions.put(comparator.key(), value);
            return this;
        }
    }
}
