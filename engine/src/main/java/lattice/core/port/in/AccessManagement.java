package lattice.core.port.in;

import lattice.core.model.Permission;
import lattice.core.model.Role;
import lattice.core.port.out.AuthorizationStore;

/**
 * Port for changing roles and permissions through the query service.
 *
 * <p>Mutations made here invalidate cached effective permissions; mutations made
 * directly on the {@link AuthorizationStore} are only picked up once cached entries
 * expire. Edits to a role's direct permissions invalidate only that role. Edits that
 * change what other roles inherit invalidate the whole workspace.
 */
public interface AccessManagement {

    void createRole(Role role);

    void updateRole(Role role);

    void deleteRole(String workspaceId, String roleId);

    void addRoleParent(String workspaceId, String roleId, String parentRoleId);

    void removeRoleParent(String workspaceId, String roleId, String parentRoleId);

    void addPermissionToRole(String workspaceId, String roleId, String permissionId);

    void removePermissionFromRole(String workspaceId, String roleId, String permissionId);

    void createPermission(Permission permission);

    void updatePermission(Permission permission);

    void deletePermission(String workspaceId, String permissionId);

    void addPermissionParent(String workspaceId, String permissionId, String parentPermissionId);

    void removePermissionParent(String workspaceId, String permissionId, String parentPermissionId);

    /**
     * Drop the cached effective permissions of one role.
     */
    void invalidate(String workspaceId, String roleId);

    /**
     * Drop the cached effective permissions of every role in a workspace.
     */
    void invalidateWorkspace(String workspaceId);

    /**
     * Drop every cached entry.
     */
    void invalidateAll();

    /**
     * The underlying store. Changes made on it directly bypass cache invalidation.
     */
    AuthorizationStore store();
}
