package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.spi.ElementFilter;
import io.github.cyfko.elementql.core.spi.QueryHandle;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link QueryHandle} accumulating {@link PredicateResolver restrictions} and running them as
 * one Criteria query over {@link ElementEntity}.
 * <p>
 * Handles are immutable: each restriction returns a new handle, and nothing touches the
 * database before {@link #toElements()}. Results are ordered by element identifier.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaQueryHandle implements QueryHandle<ElementEntity> {

    private static final Logger log = Logger.getLogger(JpaQueryHandle.class.getName());

    private final EntityManager em;
    private final JpaEntityClassRegistry entities;
    private final List<PredicateResolver<ElementEntity>> restrictions;

    JpaQueryHandle(EntityManager em, List<PredicateResolver<ElementEntity>> restrictions) {
        this.em = Objects.requireNonNull(em, "entityManager cannot be null");
        this.entities = new JpaEntityClassRegistry(em.getMetamodel());
        this.restrictions = List.copyOf(restrictions);
    }

    private JpaQueryHandle with(PredicateResolver<ElementEntity> restriction) {
        List<PredicateResolver<ElementEntity>> next = new ArrayList<>(restrictions);
        next.add(restriction);
        return new JpaQueryHandle(em, next);
    }

    @Override
    public JpaQueryHandle ofClass(Class<?> elementClass) {
        Objects.requireNonNull(elementClass, "elementClass cannot be null");
        if (!entities.isElementEntity(elementClass)) {
            return with((root, query, cb) -> cb.disjunction());
        }
        return with((root, query, cb) -> cb.equal(root.type(), elementClass));
    }

    @Override
    public JpaQueryHandle ofCategory(CategoryId category) {
        long id = Objects.requireNonNull(category, "category cannot be null").value();
        return with((root, query, cb) -> cb.equal(root.get("categoryId"), id));
    }

    @Override
    public JpaQueryHandle whereElementIsNotElementType() {
        return with((root, query, cb) -> cb.isFalse(root.get("elementType")));
    }

    @Override
    public JpaQueryHandle whereElementIsElementType() {
        return with((root, query, cb) -> cb.isTrue(root.get("elementType")));
    }

    @Override
    public JpaQueryHandle whereElementIsViewIndependent() {
        return with((root, query, cb) -> cb.isNull(root.get("ownerViewId")));
    }

    @Override
    public JpaQueryHandle wherePasses(ElementFilter filter) {
        if (!(filter instanceof JpaParameterFilter parameterFilter)) {
            throw new IllegalArgumentException("Not a JPA filter: " + filter);
        }
        return with(parameterFilter.toResolver());
    }

    /**
     * Restricts the handle to elements owned by {@code view} or explicitly visible in it.
     */
    JpaQueryHandle inView(long view) {
        return with((root, query, cb) -> cb.or(
                cb.equal(root.get("ownerViewId"), view),
                cb.isMember(view, root.<Set<Long>>get("visibleInViews"))));
    }

    @Override
    public List<ElementEntity> toElements() {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<ElementEntity> query = cb.createQuery(ElementEntity.class);
        Root<ElementEntity> root = query.from(ElementEntity.class);

        Predicate[] predicates = restrictions.stream()
                .map(restriction -> restriction.resolve(root, query, cb))
                .toArray(Predicate[]::new);
        query.select(root).where(predicates).orderBy(cb.asc(root.get("id")));

        log.fine(() -> "Running element query with " + predicates.length + " restriction(s)");
        return em.createQuery(query).getResultList();
    }
}
