package io.github.cyfko.elementql.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred generator of JPA Criteria predicates.
 * <p>
 * A {@code PredicateResolver} captures one restriction of an element query and builds the
 * matching {@link Predicate} only when the query is assembled, given its root, the query
 * itself (for subqueries) and the criteria builder. Resolvers are stateless and may be reused
 * across queries.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * PredicateResolver<ElementEntity> types = (root, query, cb) -> cb.isTrue(root.get("elementType"));
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<ElementEntity> query = cb.createQuery(ElementEntity.class);
 * Root<ElementEntity> root = query.from(ElementEntity.class);
 * query.where(types.resolve(root, query, cb));
 * }</pre>
 *
 * @param <E> the entity type this resolver applies to
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate for this restriction.
     *
     * @param root  the query root
     * @param query the query being built, used to create subqueries
     * @param cb    the criteria builder
     * @return the predicate
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
