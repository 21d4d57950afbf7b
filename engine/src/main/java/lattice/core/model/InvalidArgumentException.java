package lattice.core.model;

/**
 * Thrown when a required identifier is missing or blank, or when a query that
 * needs at least one permission ID receives none.
 */
public class InvalidArgumentException extends AuthorizationException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
