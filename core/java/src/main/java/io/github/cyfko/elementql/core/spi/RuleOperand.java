package io.github.cyfko.elementql.core.spi;

/**
 * Right-hand side of a parameter comparison together with its comparator-specific modifiers.
 * <p>
 * Three shapes exist, mirroring the storage types parameters can have:
 * </p>
 * <ul>
 *   <li>{@link StringOperand}: text value plus case-sensitivity</li>
 *   <li>{@link IntegerOperand}: exact integral value</li>
 *   <li>{@link DoubleOperand}: floating-point value plus comparison tolerance</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface RuleOperand {

    /**
     * @return the comparison value
     */
    Object value();
}
