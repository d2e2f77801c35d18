package io.github.cyfko.elementql.core.spi;

/**
 * Low-level comparison rule produced by a {@link FilterRuleFactory}.
 * <p>
 * The type is opaque to the core: it is only handed back to the same factory through
 * {@link FilterRuleFactory#createParameterFilter(FilterRule, boolean)}.
 * </p>
 *
 * @since 1.0.0
 */
public interface FilterRule {
}
