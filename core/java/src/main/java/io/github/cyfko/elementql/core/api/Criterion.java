package io.github.cyfko.elementql.core.api;

import io.github.cyfko.elementql.core.exception.UnsupportedFilterException;

/**
 * Enumeration of the selection criteria a collector understands.
 * <p>
 * Each criterion defines its key (the name callers use in raw criteria maps) and its
 * {@link Kind}, which tells the filter chain how the value is applied to the query engine.
 * The vocabulary is fixed: every criterion maps to exactly one query engine operation.
 * </p>
 *
 * <p><strong>Criterion to engine operation mappings:</strong></p>
 * <ul>
 *     <li>of_class / {@code ofClass(Class)}</li>
 *     <li>of_category / {@code ofCategory(CategoryId)}</li>
 *     <li>is_element / {@code whereElementIsNotElementType()}</li>
 *     <li>is_element_type / {@code whereElementIsElementType()}</li>
 *     <li>is_view_independent / {@code whereElementIsViewIndependent()}</li>
 *     <li>parameter_filter / {@code wherePasses(ElementFilter)}</li>
 * </ul>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Criterion criterion = Criterion.fromKey("of_category");   // OF_CATEGORY
 * criterion.kind();                                          // Kind.IDENTIFIER
 *
 * Criterion.fromKey("bogus_key");                            // throws UnsupportedFilterException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Criterion {

    /** Restrict to elements of one exact element class. */
    OF_CLASS("of_class", Kind.IDENTIFIER),

    /** Restrict to elements of one category. */
    OF_CATEGORY("of_category", Kind.IDENTIFIER),

    /** Restrict to element instances, excluding type definitions. */
    IS_ELEMENT("is_element", Kind.TOGGLE),

    /** Restrict to type definitions. */
    IS_ELEMENT_TYPE("is_element_type", Kind.TOGGLE),

    /** Restrict to elements not owned by a view. */
    IS_VIEW_INDEPENDENT("is_view_independent", Kind.TOGGLE),

    /** Restrict to elements passing a {@link ParameterRule}. */
    PARAMETER_FILTER("parameter_filter", Kind.RULE);

    /**
     * How a criterion value is handed to the query engine.
     */
    public enum Kind {
        /** The value is an identifier (or a shorthand name resolved into one) passed as the operation argument. */
        IDENTIFIER,
        /** The value is a boolean; {@code true} applies a zero-argument operation, {@code false} applies nothing. */
        TOGGLE,
        /** The value is a {@link ParameterRule} whose opaque filter is passed to the engine. */
        RULE
    }

    private final String key;
    private final Kind kind;

    Criterion(String key, Kind kind) {
        this.key = key;
        this.kind = kind;
    }

    /**
     * Returns the name used for this criterion in raw criteria maps, e.g. {@code "of_class"}.
     *
     * @return the criterion key
     */
    public String key() {
        return key;
    }

    /**
     * @return the kind of value this criterion accepts
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Finds a {@code Criterion} by its key.
     * <p>
     * Matching is exact on the trimmed key; the enum constant name (e.g. {@code "OF_CLASS"})
     * is accepted as well.
     * </p>
     *
     * @param key criterion key to search for
     * @return matching criterion, never {@code null}
     * @throws UnsupportedFilterException if no criterion has this key
     * @throws NullPointerException       if {@code key} is {@code null}
     */
    public static Criterion fromKey(String key) {
        String trimmed = key.trim();
        for (Criterion criterion : values()) {
            if (criterion.key.equals(trimmed) || criterion.name().equals(trimmed)) {
                return criterion;
            }
        }
        throw new UnsupportedFilterException(key);
    }
}
