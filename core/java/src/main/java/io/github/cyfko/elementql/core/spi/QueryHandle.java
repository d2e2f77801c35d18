package io.github.cyfko.elementql.core.spi;

import io.github.cyfko.elementql.core.model.CategoryId;

import java.util.List;

/**
 * Intermediate, narrowed query against an element store.
 * <p>
 * Every restriction returns a handle that is at least as narrow as the receiver. Restrictions
 * of this kind commute: applying the same set in any order selects the same elements.
 * Nothing is read from the store until {@link #toElements()} is called, so building a handle
 * has no side effect.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * List<Element> wallTypes = store.collect()
 *     .ofCategory(wallsCategory)
 *     .whereElementIsElementType()
 *     .toElements();
 * }</pre>
 *
 * @param <E> element type produced by the store
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryHandle<E> {

    /**
     * Restricts to elements whose class is exactly {@code elementClass}.
     */
    QueryHandle<E> ofClass(Class<?> elementClass);

    QueryHandle<E> ofCategory(CategoryId category);

    /**
     * Restricts to element instances, excluding type definitions.
     */
    QueryHandle<E> whereElementIsNotElementType();

    /**
     * Restricts to type definitions.
     */
    QueryHandle<E> whereElementIsElementType();

    /**
     * Restricts to elements that are not owned by any view.
     */
    QueryHandle<E> whereElementIsViewIndependent();

    /**
     * Restricts to elements accepted by {@code filter}.
     *
     * @throws IllegalArgumentException if the filter was produced by another engine
     */
    QueryHandle<E> wherePasses(ElementFilter filter);

    /**
     * Runs the query and returns every matching element in the engine's natural order.
     *
     * @return matching elements, never {@code null}
     */
    List<E> toElements();
}
