package io.github.cyfko.elementql.core.exception;

/**
 * Exception thrown when a criterion receives a value of the wrong kind.
 * <p>
 * Typical causes are a non-boolean value for a toggle such as {@code is_element_type},
 * a value that is not a {@link io.github.cyfko.elementql.core.api.ParameterRule} for
 * {@code parameter_filter}, or an identifier of the wrong type for {@code of_category}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CriterionValueException extends RuntimeException {

    public CriterionValueException(String message) {
        super(message);
    }
}
