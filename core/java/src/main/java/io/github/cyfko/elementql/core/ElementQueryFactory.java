package io.github.cyfko.elementql.core;

import io.github.cyfko.elementql.core.api.Criteria;
import io.github.cyfko.elementql.core.api.ParameterRule;
import io.github.cyfko.elementql.core.config.ElementQueryConfig;
import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.core.rule.RuleBuilder;
import io.github.cyfko.elementql.core.spi.ElementStore;

import java.util.Map;
import java.util.Objects;

/**
 * High-level entry point binding an {@link ElementStore} to a configuration.
 * <p>
 * The factory hands out {@link ElementCollector collectors} over the store and a
 * {@link RuleBuilder} bound to the store's rule factory, so callers never wire the
 * pieces themselves.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ElementQueryFactory<MemoryElement> query = ElementQueryFactory.of(store);
 *
 * ParameterRule tall = query.rules().parameter("Height").greater(10.0).build();
 *
 * List<MemoryElement> tallWalls = query.collector()
 *     .filter(Criteria.builder().ofCategory("Walls").isElement(true).parameterFilter(tall).build())
 *     .elements();
 *
 * // Scoped to one view
 * ElementCollector<MemoryElement> inView = query.collector(viewId, Map.of("of_class", "TextNote"));
 * }</pre>
 *
 * <p>Instances are immutable and may be shared; the collectors they create are not.</p>
 *
 * @param <E> element type produced by the store
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ElementQueryFactory<E> {

    private final ElementStore<E> store;
    private final ElementQueryConfig config;

    private ElementQueryFactory(ElementStore<E> store, ElementQueryConfig config) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Creates a factory with {@link ElementQueryConfig#defaults()}.
     */
    public static <E> ElementQueryFactory<E> of(ElementStore<E> store) {
        return new ElementQueryFactory<>(store, ElementQueryConfig.defaults());
    }

    public static <E> ElementQueryFactory<E> of(ElementStore<E> store, ElementQueryConfig config) {
        return new ElementQueryFactory<>(store, config);
    }

    /**
     * @return a new, empty collector over the whole document
     */
    public ElementCollector<E> collector() {
        return new ElementCollector<>(store);
    }

    /**
     * @return a new, empty collector scoped to {@code view}
     */
    public ElementCollector<E> collector(ElementId view) {
        return new ElementCollector<>(store, view);
    }

    public ElementCollector<E> collector(Criteria criteria) {
        return new ElementCollector<>(store, criteria);
    }

    public ElementCollector<E> collector(Map<String, ?> criteria) {
        return new ElementCollector<>(store, Criteria.from(criteria));
    }

    public ElementCollector<E> collector(ElementId view, Criteria criteria) {
        return new ElementCollector<>(store, Objects.requireNonNull(view, "view cannot be null"), criteria);
    }

    public ElementCollector<E> collector(ElementId view, Map<String, ?> criteria) {
        return collector(view, Criteria.from(criteria));
    }

    /**
     * @return a rule builder bound to the store's rule factory and this factory's configuration
     */
    public RuleBuilder rules() {
        return new RuleBuilder(store.ruleFactory(), config);
    }

    /**
     * Shortcut for {@code rules().build(parameter, conditions)}.
     */
    public ParameterRule rule(String parameter, Map<String, ?> conditions) {
        return rules().build(parameter, conditions);
    }

    public ElementStore<E> getStore() {
        return store;
    }

    public ElementQueryConfig getConfig() {
        return config;
    }
}
