package lattice.core.util;

import java.util.Collection;

import lattice.core.model.InvalidArgumentException;

/**
 * Argument checks shared by the store, resolver and query service.
 */
public final class Identifiers {

    private Identifiers() {}

    /**
     * Require an identifier to be non-null and non-blank.
     *
     * @param value the identifier
     * @param name  argument name used in the error message
     * @return the identifier
     * @throws InvalidArgumentException if the identifier is null or blank
     */
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(name + " cannot be null or blank");
        }
        return value;
    }

    /**
     * Require every identifier in a collection to be non-blank.
     *
     * @param values the identifiers, may be empty
     * @param name   argument name used in the error message
     * @throws InvalidArgumentException if any element is null or blank
     */
    public static void requireAllNonBlank(Collection<String> values, String name) {
        for (final var value : values) {
            if (value == null || value.isBlank()) {
                throw new InvalidArgumentException(name + " cannot contain null or blank IDs");
            }
        }
    }

    /**
     * Require a non-empty collection of non-blank identifiers.
     *
     * @throws InvalidArgumentException if the collection is null, empty, or has a blank element
     */
    public static void requireNonEmpty(Collection<String> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new InvalidArgumentException(name + " must contain at least one ID");
        }
        requireAllNonBlank(values, name);
    }
}
