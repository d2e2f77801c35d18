package io.github.cyfko.elementql.core.exception;

/**
 * Exception thrown when parameter rule conditions cannot be turned into a rule.
 * <p>
 * This runtime exception signals construction errors detected by the
 * {@link io.github.cyfko.elementql.core.rule.RuleBuilder} before the query engine is
 * involved.
 * </p>
 *
 * <p><strong>Common Failure Scenarios:</strong></p>
 * <ul>
 *   <li>No comparator among the conditions</li>
 *   <li>More than one comparator among the conditions</li>
 *   <li>An operand that is neither text, integer nor floating-point</li>
 *   <li>A modifier ({@code case_sensitive}, {@code precision}, {@code negated}) of the wrong type</li>
 *   <li>An unknown condition key while {@code UnknownConditionPolicy.STRICT_EXCEPTION} is active</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     ParameterRule rule = rules.build(ParameterId.of("Height"), Map.of("greater", 10.0, "less", 20.0));
 * } catch (RuleDefinitionException e) {
 *     logger.warning("Invalid parameter rule: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RuleDefinitionException extends RuntimeException {

    /**
     * @param message explanation of the construction failure
     */
    public RuleDefinitionException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the construction failure
     * @param cause   underlying failure
     */
    public RuleDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
