package io.github.cyfko.elementql.core.spi;

import io.github.cyfko.elementql.core.model.ElementId;

/**
 * Entry point into an element store: the query engine together with the lookup tables the
 * core needs to resolve shorthands and build parameter rules.
 * <p>
 * The store is externally mutable. Each handle obtained from {@link #collect()} reflects the
 * store as it is when {@link QueryHandle#toElements()} runs.
 * </p>
 *
 * @param <E> element type produced by the store
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ElementStore<E> {

    /**
     * @return an unrestricted handle over the whole document
     */
    QueryHandle<E> collect();

    /**
     * @param view the view to scope to
     * @return a handle restricted to the elements of one view
     */
    QueryHandle<E> collect(ElementId view);

    CategoryRegistry categories();

    ElementClassRegistry classes();

    FilterRuleFactory ruleFactory();
}
