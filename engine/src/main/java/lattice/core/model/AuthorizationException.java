package lattice.core.model;

/**
 * Base exception for all failures raised by the authorization engine.
 *
 * <p>Exceptions are unchecked and are never retried or logged by the engine; the
 * caller decides how to react. A failed lookup must never be read as a grant.
 */
public abstract class AuthorizationException extends RuntimeException {

    private final ErrorKind kind;

    protected AuthorizationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AuthorizationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
