package io.github.cyfko.elementql.core.spi;

/**
 * Engine-specific predicate consumed by {@link QueryHandle#wherePasses(ElementFilter)}.
 * <p>
 * Instances are created by {@link FilterRuleFactory#createParameterFilter(FilterRule, boolean)}
 * and travel through the core untouched, wrapped in a
 * {@link io.github.cyfko.elementql.core.api.ParameterRule}.
 * </p>
 *
 * @since 1.0.0
 */
public interface ElementFilter {
}
