package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.core.spi.CategoryRegistry;
import io.github.cyfko.elementql.core.spi.ElementClassRegistry;
import io.github.cyfko.elementql.core.spi.ElementStore;
import io.github.cyfko.elementql.core.spi.FilterRuleFactory;
import jakarta.persistence.EntityManager;

import java.util.List;
import java.util.Objects;

/**
 * {@link ElementStore} backed by a JPA persistence unit holding {@link ElementEntity} rows.
 * <p>
 * By default category names come from {@link CategoryEntity} rows and class names from the
 * managed element entities. The store never opens or closes transactions; it only reads
 * through the given {@link EntityManager}.
 * </p>
 *
 * <pre>{@code
 * EntityManager em = emf.createEntityManager();
 * ElementQueryFactory<ElementEntity> query = ElementQueryFactory.of(new JpaElementStore(em));
 *
 * List<ElementEntity> wallTypes = query.collector(Map.of("of_category", "Walls", "is_element_type", true))
 *     .elements();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaElementStore implements ElementStore<ElementEntity> {

    private final EntityManager em;
    private final CategoryRegistry categories;
    private final ElementClassRegistry classes;
    private final FilterRuleFactory ruleFactory = new JpaFilterRuleFactory();

    public JpaElementStore(EntityManager em) {
        this(em, new JpaCategoryRegistry(em), new JpaEntityClassRegistry(em.getMetamodel()));
    }

    public JpaElementStore(EntityManager em, CategoryRegistry categories, ElementClassRegistry classes) {
        this.em = Objects.requireNonNull(em, "entityManager cannot be null");
        this.categories = Objects.requireNonNull(categories, "categories cannot be null");
        this.classes = Objects.requireNonNull(classes, "classes cannot be null");
    }

    @Override
    public JpaQueryHandle collect() {
        return new JpaQueryHandle(em, List.of());
    }

    @Override
    public JpaQueryHandle collect(ElementId view) {
        Objects.requireNonNull(view, "view cannot be null");
        return collect().inView(view.value());
    }

    @Override
    public CategoryRegistry categories() {
        return categories;
    }

    @Override
    public ElementClassRegistry classes() {
        return classes;
    }

    @Override
    public FilterRuleFactory ruleFactory() {
        return ruleFactory;
    }
}
