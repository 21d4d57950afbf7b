package lattice.core.port.out;

/**
 * Combined storage contract the authorization engine depends on.
 *
 * <p>Implementations must be thread-safe. A mutation must validate and apply
 * atomically with respect to every other call, so that two writers cannot both
 * pass a cycle check against the same stale graph.
 */
public interface AuthorizationStore extends RoleRepository, PermissionRepository {}
