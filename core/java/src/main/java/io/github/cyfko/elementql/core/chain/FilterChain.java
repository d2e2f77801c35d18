package io.github.cyfko.elementql.core.chain;

import io.github.cyfko.elementql.core.api.Criterion;
import io.github.cyfko.elementql.core.api.ParameterRule;
import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.spi.QueryHandle;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Translates resolved criteria into an ordered sequence of restrictions against a
 * {@link QueryHandle}.
 * <p>
 * The chain is a fold: starting from a base handle, each {@link ResolvedCriterion} is applied in
 * order and the narrowed handle is threaded into the next step. The criterion to operation
 * mapping is an explicit dispatch table, checked for completeness when the chain is built.
 * </p>
 *
 * <h2>Application rules</h2>
 * <ul>
 *   <li>{@link Criterion.Kind#TOGGLE}: {@code true} applies the zero-argument restriction,
 *       {@code false} applies nothing</li>
 *   <li>{@link Criterion.Kind#RULE}: the rule's opaque {@link ParameterRule#filter()} is passed on</li>
 *   <li>{@link Criterion.Kind#IDENTIFIER}: the resolved identifier is passed on as is</li>
 * </ul>
 *
 * <p>
 * Applying the chain never touches the store; it only builds a handle. The caller's list is
 * read, never modified.
 * </p>
 *
 * @param <E> element type of the handles
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterChain<E> {

    private static final Logger log = Logger.getLogger(FilterChain.class.getName());

    /**
     * One query engine operation.
     */
    @FunctionalInterface
    interface Restriction<E> {
        QueryHandle<E> apply(QueryHandle<E> handle, Object value);
    }

    private final Map<Criterion, Restriction<E>> restrictions;

    public FilterChain() {
        this(defaultRestrictions());
    }

    FilterChain(Map<Criterion, Restriction<E>> restrictions) {
        EnumMap<Criterion, Restriction<E>> table = new EnumMap<>(Criterion.class);
        table.putAll(restrictions);
        for (Criterion criterion : Criterion.values()) {
            if (!table.containsKey(criterion)) {
                throw new IllegalStateException("No query operation registered for criterion " + criterion.key());
            }
        }
        this.restrictions = table;
    }

    private static <E> Map<Criterion, Restriction<E>> defaultRestrictions() {
        Map<Criterion, Restriction<E>> table = new EnumMap<>(Criterion.class);
        table.put(Criterion.OF_CLASS, (handle, value) -> handle.ofClass((Class<?>) value));
        table.put(Criterion.OF_CATEGORY, (handle, value) -> handle.ofCategory((CategoryId) value));
        table.put(Criterion.IS_ELEMENT, (handle, value) -> handle.whereElementIsNotElementType());
        table.put(Criterion.IS_ELEMENT_TYPE, (handle, value) -> handle.whereElementIsElementType());
        table.put(Criterion.IS_VIEW_INDEPENDENT, (handle, value) -> handle.whereElementIsViewIndependent());
        table.put(Criterion.PARAMETER_FILTER, (handle, value) -> handle.wherePasses(((ParameterRule) value).filter()));
        return table;
    }

    /**
     * Applies every criterion in order, starting from {@code base}.
     *
     * @param base     the handle to narrow
     * @param criteria resolved criteria, as produced by {@link CriteriaCoercion}
     * @return the narrowed handle, {@code base} itself when nothing applies
     */
    public QueryHandle<E> apply(QueryHandle<E> base, List<ResolvedCriterion> criteria) {
        Objects.requireNonNull(base, "base handle cannot be null");
        Objects.requireNonNull(criteria, "criteria cannot be null");

        QueryHandle<E> handle = base;
        for (ResolvedCriterion step : criteria) {
            Criterion criterion = step.criterion();
            Object value = step.value();

            if (criterion.kind() == Criterion.Kind.TOGGLE && !((Boolean) value)) {
                log.fine(() -> "Skipping " + criterion.key() + "=false");
                continue;
            }

            log.fine(() -> "Applying " + criterion.key() + "=" + value);
            handle = restrictions.get(criterion).apply(handle, value);
        }
        return handle;
    }
}
