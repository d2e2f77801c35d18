package io.github.cyfko.elementql.core.model;

/**
 * Identity of an element inside an element store.
 * <p>
 * Views are elements too, so the same type is used to scope a collector to one view.
 * </p>
 *
 * @param value the raw identifier value
 * @since 1.0.0
 */
public record ElementId(long value) {

    public static ElementId of(long value) {
        return new ElementId(value);
    }

    @Override
    public String toString() {
        return "ElementId[" + value + "]";
    }
}
