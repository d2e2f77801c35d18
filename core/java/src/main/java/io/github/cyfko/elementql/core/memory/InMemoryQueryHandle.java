package io.github.cyfko.elementql.core.memory;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.spi.ElementFilter;
import io.github.cyfko.elementql.core.spi.QueryHandle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Immutable query handle over an {@link InMemoryElementStore}: a list of predicates evaluated
 * against the store contents when {@link #toElements()} runs.
 *
 * @since 1.0.0
 */
final class InMemoryQueryHandle implements QueryHandle<MemoryElement> {

    private final Supplier<Collection<MemoryElement>> source;
    private final List<Predicate<MemoryElement>> predicates;

    InMemoryQueryHandle(Supplier<Collection<MemoryElement>> source, List<Predicate<MemoryElement>> predicates) {
        this.source = source;
        this.predicates = predicates;
    }

    private InMemoryQueryHandle and(Predicate<MemoryElement> predicate) {
        List<Predicate<MemoryElement>> narrowed = new ArrayList<>(predicates.size() + 1);
        narrowed.addAll(predicates);
        narrowed.add(predicate);
        return new InMemoryQueryHandle(source, Collections.unmodifiableList(narrowed));
    }

    @Override
    public QueryHandle<MemoryElement> ofClass(Class<?> elementClass) {
        Objects.requireNonNull(elementClass, "elementClass cannot be null");
        return and(element -> element.getClass() == elementClass);
    }

    @Override
    public QueryHandle<MemoryElement> ofCategory(CategoryId category) {
        Objects.requireNonNull(category, "category cannot be null");
        return and(element -> element.getCategory().filter(category::equals).isPresent());
    }

    @Override
    public QueryHandle<MemoryElement> whereElementIsNotElementType() {
        return and(element -> !element.isElementType());
    }

    @Override
    public QueryHandle<MemoryElement> whereElementIsElementType() {
        return and(MemoryElement::isElementType);
    }

    @Override
    public QueryHandle<MemoryElement> whereElementIsViewIndependent() {
        return and(MemoryElement::isViewIndependent);
    }

    @Override
    public QueryHandle<MemoryElement> wherePasses(ElementFilter filter) {
        if (!(filter instanceof InMemoryParameterFilter parameterFilter)) {
            throw new IllegalArgumentException("Not an in-memory filter: " + filter);
        }
        return and(parameterFilter::accepts);
    }

    @Override
    public List<MemoryElement> toElements() {
        return source.get().stream()
                .filter(element -> predicates.stream().allMatch(p -> p.test(element)))
                .collect(Collectors.toList());
    }
}
