package lattice.core.port.out;

import java.util.List;

import lattice.core.model.Permission;
import lattice.core.model.Role;

/**
 * Port interface for storage of roles and their inheritance edges.
 *
 * <p>Every method takes the workspace explicitly or reads it from the entity.
 * Implementations must raise the documented exceptions exactly: the resolver
 * and the cache invalidation protocol depend on them.
 *
 * <ul>
 *   <li>{@link lattice.core.model.InvalidArgumentException} for a null or blank identifier</li>
 *   <li>{@link lattice.core.model.EntityNotFoundException} for a missing role, parent or permission</li>
 *   <li>{@link lattice.core.model.EntityAlreadyExistsException} when creating a taken key</li>
 *   <li>{@link lattice.core.model.CyclicInheritanceException} when an edge would form a cycle</li>
 * </ul>
 */
public interface RoleRepository {

    /**
     * Create a new role.
     *
     * <p>All parents and direct permissions must already exist in the role's workspace.
     *
     * @param role the role to create
     */
    void createRole(Role role);

    /**
     * Get a role by its ID.
     *
     * @return the role, never null
     */
    Role getRole(String workspaceId, String roleId);

    /**
     * Get all roles of a workspace. Order is not significant.
     */
    List<Role> getRoles(String workspaceId);

    /**
     * Check whether a role exists.
     */
    boolean roleExists(String workspaceId, String roleId);

    /**
     * Replace an existing role wholesale.
     *
     * <p>Validated the same way as {@link #createRole(Role)} but requires the role to exist.
     */
    void updateRole(Role role);

    /**
     * Delete a role, stripping it from the parent list of every other role in the workspace.
     */
    void deleteRole(String workspaceId, String roleId);

    /**
     * Add a parent edge. Adding an existing edge is a no-op.
     */
    void addRoleParent(String workspaceId, String roleId, String parentRoleId);

    /**
     * Remove a parent edge. Removing a missing edge is a no-op; only a missing role fails.
     */
    void removeRoleParent(String workspaceId, String roleId, String parentRoleId);

    /**
     * Get the direct parents of a role, in declaration order.
     */
    List<Role> getRoleParents(String workspaceId, String roleId);

    /**
     * Get the roles that list this role as a direct parent.
     */
    List<Role> getRoleChildren(String workspaceId, String roleId);

    /**
     * Attach a permission directly to a role. Attaching it twice is a no-op.
     */
    void addPermissionToRole(String workspaceId, String roleId, String permissionId);

    /**
     * Detach a directly attached permission. Detaching a missing one is a no-op.
     */
    void removePermissionFromRole(String workspaceId, String roleId, String permissionId);

    /**
     * Get the permissions attached directly to a role, not including inherited ones.
     */
    List<Permission> getRolePermissions(String workspaceId, String roleId);
}
