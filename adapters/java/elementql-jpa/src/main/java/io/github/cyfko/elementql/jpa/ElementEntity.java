package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.model.ElementId;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.DiscriminatorColumn;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Inheritance;
import jakarta.persistence.InheritanceType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.Table;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root of the persistent element model.
 * <p>
 * Concrete element kinds are entity subclasses sharing the {@code elements} table; the
 * {@code of_class} restriction compares the entity type, so it matches one exact subclass.
 * An element without owner view is view independent. Parameters live in the
 * {@code element_parameters} collection table, keyed by parameter name.
 * </p>
 *
 * <pre>{@code
 * @Entity
 * @DiscriminatorValue("Wall")
 * public class Wall extends ElementEntity {
 *     protected Wall() {
 *     }
 *
 *     public Wall(long id, String name, CategoryId category) {
 *         super(id, name, category, false);
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Entity
@Table(name = "elements")
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "element_class")
public abstract class ElementEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "category_id")
    private Long categoryId;

    @Column(name = "element_type", nullable = false)
    private boolean elementType;

    @Column(name = "owner_view_id")
    private Long ownerViewId;

    @ElementCollection
    @CollectionTable(name = "element_visibility", joinColumns = @JoinColumn(name = "element_id"))
    @Column(name = "view_id")
    private Set<Long> visibleInViews = new HashSet<>();

    @ElementCollection
    @CollectionTable(name = "element_parameters", joinColumns = @JoinColumn(name = "element_id"))
    @MapKeyColumn(name = "parameter_name")
    private Map<String, ParameterValue> parameters = new HashMap<>();

    protected ElementEntity() {
    }

    /**
     * @param id          element identifier
     * @param name        display name
     * @param category    category, or {@code null} for uncategorized elements
     * @param elementType {@code true} for a type definition
     */
    protected ElementEntity(long id, String name, CategoryId category, boolean elementType) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.categoryId = category == null ? null : category.value();
        this.elementType = elementType;
    }

    /**
     * Sets a parameter value.
     *
     * @throws IllegalArgumentException if the value is not text, integral, floating-point or boolean
     */
    public ElementEntity withParameter(String parameter, Object value) {
        parameters.put(Objects.requireNonNull(parameter, "parameter cannot be null"), ParameterValue.of(value));
        return this;
    }

    public ElementEntity ownedBy(ElementId view) {
        this.ownerViewId = Objects.requireNonNull(view, "view cannot be null").value();
        return this;
    }

    public ElementEntity visibleIn(ElementId view) {
        visibleInViews.add(Objects.requireNonNull(view, "view cannot be null").value());
        return this;
    }

    public ElementId getId() {
        return ElementId.of(id);
    }

    public String getName() {
        return name;
    }

    public Optional<CategoryId> getCategory() {
        return Optional.ofNullable(categoryId).map(CategoryId::of);
    }

    public boolean isElementType() {
        return elementType;
    }

    public Optional<ElementId> getOwnerView() {
        return Optional.ofNullable(ownerViewId).map(ElementId::of);
    }

    public boolean isViewIndependent() {
        return ownerViewId == null;
    }

    /**
     * @return the parameter value, empty if the element lacks the parameter
     */
    public Optional<Object> parameter(String parameter) {
        ParameterValue value = parameters.get(parameter);
        return value == null ? Optional.empty() : Optional.ofNullable(value.value());
    }

    public Map<String, ParameterValue> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", " + name + "]";
    }
}
