package io.github.cyfko.elementql.core.api;

import io.github.cyfko.elementql.core.exception.CriterionValueException;
import io.github.cyfko.elementql.core.exception.UnsupportedFilterException;
import io.github.cyfko.elementql.core.model.CategoryId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered set of selection criteria.
 * <p>
 * A {@code Criteria} holds at most one value per {@link Criterion}. Iteration order is the
 * order in which criteria were first added, which keeps the restriction sequence applied to
 * the query engine deterministic.
 * </p>
 *
 * <h2>Value kinds</h2>
 * <ul>
 *   <li>{@link Criterion.Kind#IDENTIFIER}: stored as an {@link Identifier}, resolved or named</li>
 *   <li>{@link Criterion.Kind#TOGGLE}: stored as a {@link Boolean}</li>
 *   <li>{@link Criterion.Kind#RULE}: stored as a {@link ParameterRule}</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * // Fluent form
 * Criteria walls = Criteria.builder()
 *     .ofCategory("Walls")
 *     .isElementType(true)
 *     .build();
 *
 * // Raw form, keys as in the criterion vocabulary
 * Criteria same = Criteria.from(Map.of("of_category", "Walls", "is_element_type", true));
 *
 * // Newer values win
 * Criteria merged = walls.merge(Criteria.of(Criterion.IS_ELEMENT_TYPE, false));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Criteria {

    private static final Criteria EMPTY = new Criteria(new LinkedHashMap<>());

    private final Map<Criterion, Object> values;

    private Criteria(LinkedHashMap<Criterion, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Criteria empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates criteria holding a single value.
     *
     * @param criterion the criterion
     * @param value     raw value, normalized as in {@link #from(Map)}
     * @return new criteria
     * @throws CriterionValueException if the value does not suit the criterion kind
     */
    public static Criteria of(Criterion criterion, Object value) {
        return builder().put(criterion, value).build();
    }

    /**
     * Creates criteria from a raw mapping of criterion keys to values.
     * <p>
     * Strings given for identifier criteria become shorthand names, any other value is taken
     * as an already resolved identifier. The map is read once and never modified.
     * </p>
     *
     * @param raw criterion key to value mapping
     * @return new criteria in the iteration order of {@code raw}
     * @throws UnsupportedFilterException if a key is not a supported criterion
     * @throws CriterionValueException    if a value does not suit its criterion kind
     */
    public static Criteria from(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "criteria map cannot be null");
        Builder builder = builder();
        // keys are checked first so an unsupported name is reported before any value problem
        for (String key : raw.keySet()) {
            Criterion.fromKey(key);
        }
        raw.forEach((key, value) -> builder.put(Criterion.fromKey(key), value));
        return builder.build();
    }

    /**
     * Returns new criteria where the values of {@code newer} overwrite the values held here.
     * <p>
     * Criteria already present keep their position; criteria only present in {@code newer}
     * are appended in their own order.
     * </p>
     *
     * @param newer criteria taking precedence
     * @return merged criteria, {@code this} if {@code newer} is empty
     */
    public Criteria merge(Criteria newer) {
        Objects.requireNonNull(newer, "criteria cannot be null");
        if (newer.isEmpty()) return this;
        LinkedHashMap<Criterion, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(newer.values);
        return new Criteria(merged);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public boolean contains(Criterion criterion) {
        return values.containsKey(criterion);
    }

    /**
     * @param criterion the criterion to look up
     * @return the normalized value held for {@code criterion}
     */
    public Optional<Object> get(Criterion criterion) {
        return Optional.ofNullable(values.get(criterion));
    }

    /**
     * @return criteria names in iteration order
     */
    public Set<Criterion> names() {
        return values.keySet();
    }

    /**
     * @return an unmodifiable, ordered view of the criteria
     */
    public Map<Criterion, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Criteria other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Criteria{");
        String separator = "";
        for (Map.Entry<Criterion, Object> entry : values.entrySet()) {
            sb.append(separator).append(entry.getKey().key()).append('=').append(entry.getValue());
            separator = ", ";
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link Criteria}. Setting the same criterion twice keeps the last value.
     */
    public static final class Builder {
        private final LinkedHashMap<Criterion, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder ofClass(Class<?> elementClass) {
            return put(Criterion.OF_CLASS, Identifier.of(elementClass));
        }

        /**
         * @param className simple class name, resolved against the store's class namespace
         */
        public Builder ofClass(String className) {
            return put(Criterion.OF_CLASS, className);
        }

        public Builder ofCategory(CategoryId category) {
            return put(Criterion.OF_CATEGORY, Identifier.of(category));
        }

        /**
         * @param categoryName category name, resolved against the store's category registry
         */
        public Builder ofCategory(String categoryName) {
            return put(Criterion.OF_CATEGORY, categoryName);
        }

        public Builder isElement(boolean value) {
            return put(Criterion.IS_ELEMENT, value);
        }

        public Builder isElementType(boolean value) {
            return put(Criterion.IS_ELEMENT_TYPE, value);
        }

        public Builder isViewIndependent(boolean value) {
            return put(Criterion.IS_VIEW_INDEPENDENT, value);
        }

        public Builder parameterFilter(ParameterRule rule) {
            return put(Criterion.PARAMETER_FILTER, rule);
        }

        /**
         * Adds a raw value for the given criterion.
         *
         * @throws CriterionValueException if the value does not suit the criterion kind
         */
        public Builder put(Criterion criterion, Object value) {
            Objects.requireNonNull(criterion, "criterion cannot be null");
            values.put(criterion, normalize(criterion, value));
            return this;
        }

        public Criteria build() {
            return values.isEmpty() ? EMPTY : new Criteria(new LinkedHashMap<>(values));
        }

        private static Object normalize(Criterion criterion, Object value) {
            if (value == null) {
                throw new CriterionValueException("Criterion " + criterion.key() + " requires a value");
            }
            return switch (criterion.kind()) {
                case IDENTIFIER -> {
                    if (value instanceof Identifier<?>) yield value;
                    if (value instanceof String name) {
                        if (name.isBlank()) {
                            throw new CriterionValueException("Criterion " + criterion.key() + " requires a non-blank name");
                        }
                        yield Identifier.named(name);
                    }
                    yield Identifier.of(value);
                }
                case TOGGLE -> {
                    if (!(value instanceof Boolean)) {
                        throw new CriterionValueException("Criterion " + criterion.key()
                                + " expects a boolean, got " + value.getClass().getSimpleName());
                    }
                    yield value;
                }
                case RULE -> {
                    if (!(value instanceof ParameterRule)) {
                        throw new CriterionValueException("Criterion " + criterion.key()
                                + " expects a ParameterRule, got " + value.getClass().getSimpleName());
                    }
                    yield value;
                }
            };
        }
    }
}
