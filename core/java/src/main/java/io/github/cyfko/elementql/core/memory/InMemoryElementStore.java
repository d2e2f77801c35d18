package io.github.cyfko.elementql.core.memory;

import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.core.spi.CategoryRegistry;
import io.github.cyfko.elementql.core.spi.ElementClassRegistry;
import io.github.cyfko.elementql.core.spi.ElementStore;
import io.github.cyfko.elementql.core.spi.FilterRuleFactory;
import io.github.cyfko.elementql.core.spi.QueryHandle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Element store kept in memory, enumerated in insertion order.
 * <p>
 * The store is mutable: elements may be added or removed while collectors exist, and each
 * query sees the contents at the time it runs. A view scope holds the elements owned by the
 * view and those made visible in it.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * InMemoryElementStore store = new InMemoryElementStore(categories, new ClassNamespace(Wall.class))
 *     .add(new Wall(1, "Wall 1", WALLS))
 *     .add(new WallType(2, "Generic - 200mm", WALLS));
 *
 * List<MemoryElement> types = store.collect().whereElementIsElementType().toElements();
 * }</pre>
 *
 * <p><strong>Concurrency:</strong> not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InMemoryElementStore implements ElementStore<MemoryElement> {

    private final Map<ElementId, MemoryElement> elements = new LinkedHashMap<>();
    private final CategoryRegistry categories;
    private final ElementClassRegistry classes;
    private final InMemoryRuleFactory ruleFactory = new InMemoryRuleFactory();

    public InMemoryElementStore(CategoryRegistry categories, ElementClassRegistry classes) {
        this.categories = Objects.requireNonNull(categories, "categories cannot be null");
        this.classes = Objects.requireNonNull(classes, "classes cannot be null");
    }

    /**
     * Adds an element at the end of the enumeration order.
     *
     * @throws IllegalArgumentException if an element with the same id is already stored
     */
    public InMemoryElementStore add(MemoryElement element) {
        Objects.requireNonNull(element, "element cannot be null");
        MemoryElement previous = elements.putIfAbsent(element.getId(), element);
        if (previous != null) {
            throw new IllegalArgumentException("Element " + element.getId() + " is already stored as " + previous);
        }
        return this;
    }

    public InMemoryElementStore addAll(Collection<? extends MemoryElement> toAdd) {
        toAdd.forEach(this::add);
        return this;
    }

    /**
     * @return {@code true} if an element was removed
     */
    public boolean remove(ElementId id) {
        return elements.remove(id) != null;
    }

    public Optional<MemoryElement> get(ElementId id) {
        return Optional.ofNullable(elements.get(id));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public QueryHandle<MemoryElement> collect() {
        return new InMemoryQueryHandle(this::snapshot, List.of());
    }

    @Override
    public QueryHandle<MemoryElement> collect(ElementId view) {
        Objects.requireNonNull(view, "view cannot be null");
        return new InMemoryQueryHandle(this::snapshot, List.<Predicate<MemoryElement>>of(element -> element.isInScopeOf(view)));
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

    private Collection<MemoryElement> snapshot() {
        return new ArrayList<>(elements.values());
    }
}
