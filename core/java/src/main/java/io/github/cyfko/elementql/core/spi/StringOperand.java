package io.github.cyfko.elementql.core.spi;

import java.util.Objects;

/**
 * Text operand.
 *
 * @param value         text to compare with
 * @param caseSensitive whether comparison honours letter case
 * @since 1.0.0
 */
public record StringOperand(String value, boolean caseSensitive) implements RuleOperand {

    public StringOperand {
        Objects.requireNonNull(value, "value cannot be null");
    }
}
