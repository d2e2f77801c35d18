package io.github.cyfko.elementql.core.spi;

/**
 * Integral operand, compared exactly.
 *
 * @param value number to compare with
 * @since 1.0.0
 */
public record IntegerOperand(Long value) implements RuleOperand {

    public IntegerOperand(long value) {
        this(Long.valueOf(value));
    }
}
