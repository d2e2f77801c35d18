package io.github.cyfko.elementql.core.spi;

/**
 * Floating-point operand compared within a tolerance.
 * <p>
 * Two values {@code a} and {@code b} are considered equal when {@code |a - b| <= tolerance}.
 * </p>
 *
 * @param value     number to compare with
 * @param tolerance non-negative comparison tolerance
 * @since 1.0.0
 */
public record DoubleOperand(Double value, double tolerance) implements RuleOperand {

    public DoubleOperand {
        if (value == null || value.isNaN()) {
            throw new IllegalArgumentException("value must be a number");
        }
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must be a non-negative number");
        }
    }

    public DoubleOperand(double value, double tolerance) {
        this(Double.valueOf(value), tolerance);
    }
}
