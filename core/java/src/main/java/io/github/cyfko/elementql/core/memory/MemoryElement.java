package io.github.cyfko.elementql.core.memory;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.model.ElementId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Element held by an {@link InMemoryElementStore}.
 * <p>
 * Concrete element kinds are modelled as subclasses: the {@code of_class} restriction matches
 * the exact runtime class. An element without owner view is view independent; an owned element
 * belongs to the scope of its owner view and of every view it was made visible in.
 * </p>
 *
 * <p>Parameter values are normalized on entry:</p>
 * <ul>
 *   <li>{@code Integer}, {@code Short}, {@code Byte}, {@code Long} are stored as {@code Long}</li>
 *   <li>{@code Float}, {@code Double} are stored as {@code Double}</li>
 *   <li>{@code Boolean} is stored as {@code Long} {@code 1} or {@code 0}</li>
 *   <li>{@code String} is stored as is</li>
 * </ul>
 *
 * <pre>{@code
 * MemoryElement wall = new Wall(101, "Wall 1", WALLS)
 *     .withParameter("Height", 12.5)
 *     .withParameter("Type Name", "Generic - 200mm")
 *     .ownedBy(ElementId.of(1));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MemoryElement {

    private final ElementId id;
    private final String name;
    private final CategoryId category;
    private final boolean elementType;
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final Set<ElementId> visibleIn = new LinkedHashSet<>();
    private ElementId ownerView;

    /**
     * @param id          element identifier, unique within a store
     * @param name        display name
     * @param category    category, or {@code null} for uncategorized elements
     * @param elementType {@code true} for a type definition, {@code false} for an instance
     */
    public MemoryElement(long id, String name, CategoryId category, boolean elementType) {
        this.id = ElementId.of(id);
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.category = category;
        this.elementType = elementType;
    }

    /**
     * Sets a parameter value, replacing any previous value.
     *
     * @throws IllegalArgumentException if the value is not text, integral, floating-point or boolean
     */
    public MemoryElement withParameter(String parameter, Object value) {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        parameters.put(parameter, normalize(parameter, value));
        return this;
    }

    /**
     * Makes this element owned by a view; it is no longer view independent.
     */
    public MemoryElement ownedBy(ElementId view) {
        this.ownerView = Objects.requireNonNull(view, "view cannot be null");
        return this;
    }

    /**
     * Adds this element to the scope of a view it is not owned by.
     */
    public MemoryElement visibleIn(ElementId view) {
        visibleIn.add(Objects.requireNonNull(view, "view cannot be null"));
        return this;
    }

    public ElementId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Optional<CategoryId> getCategory() {
        return Optional.ofNullable(category);
    }

    public boolean isElementType() {
        return elementType;
    }

    public Optional<ElementId> getOwnerView() {
        return Optional.ofNullable(ownerView);
    }

    public boolean isViewIndependent() {
        return ownerView == null;
    }

    /**
     * @return {@code true} if the element is owned by or visible in {@code view}
     */
    public boolean isInScopeOf(ElementId view) {
        return view.equals(ownerView) || visibleIn.contains(view);
    }

    /**
     * @return the normalized parameter value, empty if the element lacks the parameter
     */
    public Optional<Object> parameter(String parameter) {
        return Optional.ofNullable(parameters.get(parameter));
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    private static Object normalize(String parameter, Object value) {
        if (value instanceof String) return value;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) return ((Number) value).doubleValue();
        if (value instanceof Boolean flag) return flag ? 1L : 0L;
        throw new IllegalArgumentException("Unsupported value for parameter '" + parameter + "': "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id.value() + ", " + name + "]";
    }
}
