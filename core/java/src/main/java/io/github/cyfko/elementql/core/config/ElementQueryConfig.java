package io.github.cyfko.elementql.core.config;

import java.util.Objects;

/**
 * Central configuration object aggregating the defaults applied while building parameter rules.
 * <p>
 * Exposes the default case-sensitivity of text comparisons, the default tolerance of
 * floating-point comparisons and the {@link UnknownConditionPolicy}. A builder keeps
 * construction fluent and forward compatible.
 * </p>
 */
public final class ElementQueryConfig {

    /** Default tolerance of floating-point comparisons: 1/768 of a unit. */
    public static final double DEFAULT_PRECISION = 0.0013020833333333;

    private final boolean caseSensitive;
    private final double precision;
    private final UnknownConditionPolicy unknownConditionPolicy;

    private ElementQueryConfig(Builder builder) {
        this.caseSensitive = builder.caseSensitive;
        this.precision = builder.precision;
        this.unknownConditionPolicy = builder.unknownConditionPolicy;
    }

    public static Builder builder() { return new Builder(); }

    public static ElementQueryConfig defaults() { return builder().build(); }

    public boolean isCaseSensitive() { return caseSensitive; }
    public double getPrecision() { return precision; }
    public UnknownConditionPolicy getUnknownConditionPolicy() { return unknownConditionPolicy; }

    @Override
    public String toString() {
        return "ElementQueryConfig{caseSensitive=" + caseSensitive
                + ", precision=" + precision
                + ", unknownConditionPolicy=" + unknownConditionPolicy + '}';
    }

    /**
     * Builder for {@link ElementQueryConfig}.
     */
    public static final class Builder {
        private boolean caseSensitive = true;
        private double precision = DEFAULT_PRECISION;
        private UnknownConditionPolicy unknownConditionPolicy = UnknownConditionPolicy.IGNORE; // lenient by default

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder precision(double precision) {
            if (precision < 0 || Double.isNaN(precision) || Double.isInfinite(precision)) {
                throw new IllegalArgumentException("precision must be a finite, non-negative number");
            }
            this.precision = precision;
            return this;
        }

        public Builder unknownConditionPolicy(UnknownConditionPolicy policy) {
            this.unknownConditionPolicy = Objects.requireNonNull(policy, "unknownConditionPolicy");
            return this;
        }

        public ElementQueryConfig build() { return new ElementQueryConfig(this); }
    }
}
