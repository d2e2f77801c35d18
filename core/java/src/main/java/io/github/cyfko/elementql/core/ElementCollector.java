package io.github.cyfko.elementql.core;

import io.github.cyfko.elementql.core.api.Criteria;
import io.github.cyfko.elementql.core.chain.CriteriaCoercion;
import io.github.cyfko.elementql.core.chain.FilterChain;
import io.github.cyfko.elementql.core.chain.ResolvedCriterion;
import io.github.cyfko.elementql.core.exception.CriterionValueException;
import io.github.cyfko.elementql.core.exception.UnknownIdentifierException;
import io.github.cyfko.elementql.core.exception.UnsupportedFilterException;
import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.core.spi.ElementStore;
import io.github.cyfko.elementql.core.spi.QueryHandle;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Stateful collector accumulating selection criteria over an {@link ElementStore}.
 * <p>
 * Each call to {@link #filter(Criteria)} merges the new criteria into the accumulated ones
 * (newer values win), resolves shorthands, applies the complete criteria set to a fresh query
 * handle and replaces {@link #elements()} with the full result. The collector returns itself,
 * so calls chain naturally and keep narrowing.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ElementCollector<Element> collector = new ElementCollector<>(store);
 * collector.filter(Criteria.builder().ofClass("View").build());
 *
 * // Multiple criteria
 * new ElementCollector<>(store)
 *     .filter(Criteria.builder().ofCategory("Walls").isElementType(true).build());
 *
 * // Chaining keeps previous criteria
 * ElementCollector<Element> walls = new ElementCollector<>(store)
 *     .filter(Map.of("of_category", "Walls"));
 * walls.filter(Map.of("is_element_type", true));
 *
 * Optional<Element> firstType = walls.first();
 * }</pre>
 *
 * <h2>Failure atomicity</h2>
 * <p>
 * A {@code filter} call either succeeds completely or leaves {@link #criteria()} and
 * {@link #elements()} exactly as they were: criteria are merged into a new snapshot and only
 * committed together with the new element list once the query has run.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Not thread-safe. Callers sharing an instance across threads must serialize access.
 * </p>
 *
 * @param <E> element type produced by the store
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ElementCollector<E> implements Iterable<E> {

    private static final Logger log = Logger.getLogger(ElementCollector.class.getName());

    private final ElementStore<E> store;
    private final ElementId view;
    private final CriteriaCoercion coercion;
    private final FilterChain<E> chain;

    private Criteria criteria = Criteria.empty();
    private List<E> elements = Collections.emptyList();
    private boolean materialized;

    /**
     * Creates an empty collector over the whole document.
     */
    public ElementCollector(ElementStore<E> store) {
        this(store, null, Criteria.empty());
    }

    /**
     * Creates an empty collector scoped to one view.
     */
    public ElementCollector(ElementStore<E> store, ElementId view) {
        this(store, Objects.requireNonNull(view, "view cannot be null"), Criteria.empty());
    }

    /**
     * Creates a collector over the whole document and applies {@code initial} right away.
     */
    public ElementCollector(ElementStore<E> store, Criteria initial) {
        this(store, null, initial);
    }

    /**
     * Creates a collector, optionally scoped to one view, and applies {@code initial} right away
     * when it is not empty.
     *
     * @param store   the element store
     * @param view    view scope, or {@code null} for the whole document
     * @param initial criteria to apply on construction
     */
    public ElementCollector(ElementStore<E> store, ElementId view, Criteria initial) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.view = view;
        this.coercion = new CriteriaCoercion(store.categories(), store.classes());
        this.chain = new FilterChain<>();
        Objects.requireNonNull(initial, "initial criteria cannot be null");
        if (!initial.isEmpty()) {
            filter(initial);
        }
    }

    /**
     * Adds criteria given as a raw key to value mapping.
     *
     * @see Criteria#from(Map)
     * @see #filter(Criteria)
     */
    public ElementCollector<E> filter(Map<String, ?> criteria) {
        return filter(Criteria.from(criteria));
    }

    /**
     * Adds criteria and re-runs the query with the complete accumulated set.
     * <p>
     * Empty criteria on a collector that has already run change nothing. On a collector that
     * never ran, empty criteria collect every element in scope.
     * </p>
     *
     * @param newCriteria criteria to add; values replace accumulated values of the same name
     * @return this collector
     * @throws UnknownIdentifierException if a category or class name cannot be resolved
     * @throws CriterionValueException    if a value does not suit its criterion
     * @throws UnsupportedFilterException never for typed criteria; raised by {@link #filter(Map)}
     */
    public ElementCollector<E> filter(Criteria newCriteria) {
        Objects.requireNonNull(newCriteria, "criteria cannot be null");
        if (newCriteria.isEmpty() && materialized) {
            return this;
        }

        Criteria merged = criteria.merge(newCriteria);
        List<ResolvedCriterion> resolved = coercion.coerce(merged);
        QueryHandle<E> handle = chain.apply(view == null ? store.collect() : store.collect(view), resolved);

        long start = System.nanoTime();
        List<E> result = List.copyOf(handle.toElements());
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.fine(() -> String.format("Collected %d element(s) for %s in %d ms", result.size(), merged, durationMs));

        this.criteria = merged;
        this.elements = result;
        this.materialized = true;
        return this;
    }

    /**
     * @return the first collected element in the engine's order, or empty if none
     */
    public Optional<E> first() {
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
    }

    /**
     * @return {@code true} if no element is collected
     */
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    /**
     * @return collected elements, unmodifiable
     */
    public List<E> elements() {
        return elements;
    }

    /**
     * @return the accumulated criteria
     */
    public Criteria criteria() {
        return criteria;
    }

    /**
     * @return the view scope, empty for a document-wide collector
     */
    public Optional<ElementId> view() {
        return Optional.ofNullable(view);
    }

    public Stream<E> stream() {
        return elements.stream();
    }

    @Override
    public Iterator<E> iterator() {
        return elements.iterator();
    }

    @Override
    public String toString() {
        return "ElementCollector{size=" + elements.size() + ", criteria=" + criteria + '}';
    }
}
