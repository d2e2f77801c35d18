package io.github.cyfko.elementql.core.exception;

import io.github.cyfko.elementql.core.api.Criterion;

/**
 * Exception thrown when a shorthand name given for {@link Criterion#OF_CATEGORY} or
 * {@link Criterion#OF_CLASS} cannot be resolved into a canonical identifier.
 * <p>
 * The exception is surfaced immediately to the caller and never retried. It names both
 * the criterion and the unresolved string so that typos are easy to spot.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * collector.filter(Criteria.builder().ofCategory("Wals").build());
 * // -> UnknownIdentifierException: Unknown identifier 'Wals' for criterion of_category
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownIdentifierException extends RuntimeException {

    private final Criterion criterion;
    private final String name;

    /**
     * @param criterion the criterion whose value failed to resolve
     * @param name      the unresolved shorthand
     */
    public UnknownIdentifierException(Criterion criterion, String name) {
        super("Unknown identifier '" + name + "' for criterion " + criterion.key());
        this.criterion = criterion;
        this.name = name;
    }

    public Criterion getCriterion() {
        return criterion;
    }

    public String getName() {
        return name;
    }
}
