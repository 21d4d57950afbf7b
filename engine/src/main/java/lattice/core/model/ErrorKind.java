package lattice.core.model;

/**
 * Kinds of failure an authorization call can report.
 *
 * <p>Every {@link AuthorizationException} carries exactly one kind. Callers that
 * make access decisions should treat any kind as a denial.
 */
public enum ErrorKind {

    /** A required identifier or argument was missing or blank. */
    INVALID_ARGUMENT,

    /** A referenced role, permission or parent does not exist in the workspace. */
    NOT_FOUND,

    /** An entity with the same workspace and ID already exists. */
    ALREADY_EXISTS,

    /** A proposed parent edge would make an entity its own ancestor. */
    CYCLIC_INHERITANCE,

    /** The backing store failed. Never raised by the in-memory store. */
    STORE_FAILURE
}
