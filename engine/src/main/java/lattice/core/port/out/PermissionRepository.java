package lattice.core.port.out;

import java.util.List;

import lattice.core.model.Permission;

/**
 * Port interface for storage of permissions and their inheritance edges.
 *
 * <p>Error contract matches {@link RoleRepository}.
 */
public interface PermissionRepository {

    /**
     * Create a new permission. All parents must already exist in its workspace.
     */
    void createPermission(Permission permission);

    Permission getPermission(String workspaceId, String permissionId);

    /**
     * Get all permissions of a workspace. Order is not significant.
     */
    List<Permission> getPermissions(String workspaceId);

    boolean permissionExists(String workspaceId, String permissionId);

    /**
     * Replace an existing permission wholesale.
     */
    void updatePermission(Permission permission);

    /**
     * Delete a permission, stripping it from every other permission's parents and
     * from every role's direct permissions in the workspace.
     */
    void deletePermission(String workspaceId, String permissionId);

    /**
     * Add a parent edge. Adding an existing edge is a no-op.
     */
    void addPermissionParent(String workspaceId, String permissionId, String parentPermissionId);

    /**
     * Remove a parent edge. Removing a missing edge is a no-op; only a missing permission fails.
     */
    void removePermissionParent(String workspaceId, String permissionId, String parentPermissionId);

    List<Permission> getPermissionParents(String workspaceId, String permissionId);

    List<Permission> getPermissionChildren(String workspaceId, String permissionId);
}
