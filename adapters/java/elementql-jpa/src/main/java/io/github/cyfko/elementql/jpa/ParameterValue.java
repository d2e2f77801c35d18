package io.github.cyfko.elementql.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * Stored value of one element parameter.
 * <p>
 * Exactly one column is set. Text goes to {@code text_value}; integral numbers and booleans
 * ({@code 1} or {@code 0}) to {@code integer_value}; floating-point numbers to
 * {@code double_value}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Embeddable
public class ParameterValue {

    @Column(name = "text_value")
    private String textValue;

    @Column(name = "integer_value")
    private Long integerValue;

    @Column(name = "double_value")
    private Double doubleValue;

    protected ParameterValue() {
    }

    private ParameterValue(String textValue, Long integerValue, Double doubleValue) {
        this.textValue = textValue;
        this.integerValue = integerValue;
        this.doubleValue = doubleValue;
    }

    /**
     * @param value text, integral, floating-point or boolean value
     * @return the stored form of {@code value}
     * @throws IllegalArgumentException for any other value
     */
    public static ParameterValue of(Object value) {
        if (value instanceof String text) return new ParameterValue(text, null, null);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new ParameterValue(null, ((Number) value).longValue(), null);
        }
        if (value instanceof Double || value instanceof Float) {
            return new ParameterValue(null, null, ((Number) value).doubleValue());
        }
        if (value instanceof Boolean flag) return new ParameterValue(null, flag ? 1L : 0L, null);
        throw new IllegalArgumentException("Unsupported parameter value: "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    /**
     * @return whichever column is set
     */
    public Object value() {
        if (textValue != null) return textValue;
        if (integerValue != null) return integerValue;
        return doubleValue;
    }

    public String getTextValue() {
        return textValue;
    }

    public Long getIntegerValue() {
        return integerValue;
    }

    public Double getDoubleValue() {
        return doubleValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterValue other)) return false;
        return Objects.equals(textValue, other.textValue)
                && Objects.equals(integerValue, other.integerValue)
                && Objects.equals(doubleValue, other.doubleValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(textValue, integerValue, doubleValue);
    }

    @Override
    public String toString() {
        return String.valueOf(value());
    }
}
