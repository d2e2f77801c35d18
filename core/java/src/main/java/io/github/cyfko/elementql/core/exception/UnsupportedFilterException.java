package io.github.cyfko.elementql.core.exception;

/**
 * Exception thrown when a criterion name is not part of the supported vocabulary.
 * <p>
 * The supported names are those of {@link io.github.cyfko.elementql.core.api.Criterion}.
 * An unknown name is a configuration error, never a silent no-op: the whole
 * {@code filter} call fails before any restriction is applied and the collector keeps
 * its previous state.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * collector.filter(Map.of("bogus_key", 1));
 * // -> UnsupportedFilterException: Collector filter rule does not exist: bogus_key
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnsupportedFilterException extends RuntimeException {

    private final String filterName;

    /**
     * Creates a new exception for the given unsupported criterion name.
     *
     * @param filterName the offending criterion name as supplied by the caller
     */
    public UnsupportedFilterException(String filterName) {
        super("Collector filter rule does not exist: " + filterName);
        this.filterName = filterName;
    }

    /**
     * @return the criterion name that could not be matched
     */
    public String getFilterName() {
        return filterName;
    }
}
