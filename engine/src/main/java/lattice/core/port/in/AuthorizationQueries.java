package lattice.core.port.in;

import java.util.Collection;
import java.util.List;

import lattice.core.model.Permission;

/**
 * Port for answering authorization questions about a role.
 *
 * <p>Any exception thrown by these methods must be treated as a denial.
 */
public interface AuthorizationQueries {

    /**
     * Check whether a role holds a permission, directly or through inheritance.
     *
     * @throws lattice.core.model.InvalidArgumentException if any argument is blank
     * @throws lattice.core.model.EntityNotFoundException  if the role does not exist
     */
    boolean hasPermission(String workspaceId, String roleId, String permissionId);

    /**
     * Check whether a role holds at least one of the given permissions.
     *
     * @throws lattice.core.model.InvalidArgumentException if no permission IDs are given
     */
    boolean hasAnyPermission(String workspaceId, String roleId, String... permissionIds);

    boolean hasAnyPermission(String workspaceId, String roleId, Collection<String> permissionIds);

    /**
     * Check whether a role holds every one of the given permissions.
     *
     * @throws lattice.core.model.InvalidArgumentException if no permission IDs are given
     */
    boolean hasAllPermissions(String workspaceId, String roleId, String... permissionIds);

    boolean hasAllPermissions(String workspaceId, String roleId, Collection<String> permissionIds);

    /**
     * Get every permission a role holds, including inherited ones, ordered by ID.
     */
    List<Permission> getEffectivePermissions(String workspaceId, String roleId);
}
