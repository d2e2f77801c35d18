package io.github.cyfko.elementql.core.memory;

import io.github.cyfko.elementql.core.spi.ElementFilter;

/**
 * Element filter wrapping one {@link InMemoryFilterRule}, optionally inverted.
 *
 * @since 1.0.0
 */
public final class InMemoryParameterFilter implements ElementFilter {

    private final InMemoryFilterRule rule;
    private final boolean inverted;

    InMemoryParameterFilter(InMemoryFilterRule rule, boolean inverted) {
        this.rule = rule;
        this.inverted = inverted;
    }

    /**
     * An inverted filter accepts exactly the elements the rule rejects, including those
     * lacking the parameter.
     */
    public boolean accepts(MemoryElement element) {
        return rule.matches(element) != inverted;
    }

    public boolean isInverted() {
        return inverted;
    }

    @Override
    public String toString() {
        return (inverted ? "NOT(" : "(") + rule + ")";
    }
}
