package lattice.core.model;

/**
 * Thrown by persistent store implementations when the backing storage fails.
 */
public class StoreFailureException extends AuthorizationException {

    public StoreFailureException(String message) {
        super(ErrorKind.STORE_FAILURE, message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(ErrorKind.STORE_FAILURE, message, cause);
    }
}
