package lattice.core.service;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import lattice.core.model.InvalidArgumentException;
import lattice.core.model.Permission;
import lattice.core.model.Role;
import lattice.core.port.in.AccessManagement;
import lattice.core.port.in.AuthorizationQueries;
import lattice.core.port.out.AuthorizationStore;
import lattice.core.util.Identifiers;

/**
 * Answers authorization queries and routes mutations so cached results stay correct.
 *
 * <p>Queries read effective permissions through {@link EffectivePermissionCache}; with
 * caching disabled every query recomputes from the store.
 *
 * <p>Mutations are applied to the store first and invalidate the cache only once the
 * store accepted them. Direct-permission edits invalidate the edited role alone, which
 * leaves descendants of that role cached until their TTL elapses. Every other edit can
 * change what descendants inherit, so it invalidates the whole workspace.
 */
@ApplicationScoped
public class AuthorizationService implements AuthorizationQueries, AccessManagement {

    private final AuthorizationStore store;
    private final EffectivePermissionCache cache;

    @Inject
    public AuthorizationService(AuthorizationStore store, EffectivePermissionCache cache) {
        this.store = store;
        this.cache = cache;
    }

    /**
     * Create a service that recomputes effective permissions on every query.
     */
    public static AuthorizationService create(AuthorizationStore store) {
        return new AuthorizationService(
                store, EffectivePermissionCache.disabled(new EffectivePermissionResolver(store)));
    }

    /**
     * Create a service that caches effective permissions for the given TTL.
     */
    public static AuthorizationService create(AuthorizationStore store, Duration cacheTtl) {
        return new AuthorizationService(
                store, EffectivePermissionCache.withTtl(new EffectivePermissionResolver(store), cacheTtl));
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Override
    public boolean hasPermission(String workspaceId, String roleId, String permissionId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");
        Identifiers.requireNonBlank(permissionId, "permissionId");

        return cache.get(workspaceId, roleId).contains(permissionId);
    }

    @Override
    public boolean hasAnyPermission(String workspaceId, String roleId, String... permissionIds) {
        return hasAnyPermission(workspaceId, roleId, asList(permissionIds));
    }

    @Override
    public boolean hasAnyPermission(String workspaceId, String roleId, Collection<String> permissionIds) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");
        Identifiers.requireNonEmpty(permissionIds, "permissionIds");

        final var effective = cache.get(workspaceId, roleId);
        return permissionIds.stream().anyMatch(effective::contains);
    }

    @Override
    public boolean hasAllPermissions(String workspaceId, String roleId, String... permissionIds) {
        return hasAllPermissions(workspaceId, roleId, asList(permissionIds));
    }

    @Override
    public boolean hasAllPermissions(String workspaceId, String roleId, Collection<String> permissionIds) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");
        Identifiers.requireNonEmpty(permissionIds, "permissionIds");

        return cache.get(workspaceId, roleId).containsAll(permissionIds);
    }

    @Override
    public List<Permission> getEffectivePermissions(String workspaceId, String roleId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");

        return cache.get(workspaceId, roleId).stream()
                .map(permissionId -> store.getPermission(workspaceId, permissionId))
                .sorted(Comparator.comparing(Permission::id))
                .toList();
    }

    // ========================================================================
    // Role mutations
    // ========================================================================

    @Override
    public void createRole(Role role) {
        store.createRole(role);
    }

    @Override
    public void updateRole(Role role) {
        requireEntity(role, "role");
        store.updateRole(role);
        cache.invalidateWorkspace(role.workspaceId());
    }

    @Override
    public void deleteRole(String workspaceId, String roleId) {
        store.deleteRole(workspaceId, roleId);
        cache.invalidateWorkspace(workspaceId);
    }

    @Override
    public void addRoleParent(String workspaceId, String roleId, String parentRoleId) {
        store.addRoleParent(workspaceId, roleId, parentRoleId);
        cache.invalidateWorkspace(workspaceId);
    }

    @Override
    public void removeRoleParent(String workspaceId, String roleId, String parentRoleId) {
        store.removeRoleParent(workspaceId, roleId, parentRoleId);
        cache.invalidateWorkspace(workspaceId);
    }

    @Override
    public void addPermissionToRole(String workspaceId, String roleId, String permissionId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");
        Identifiers.requireNonBlank(permissionId, "permissionId");

        store.addPermissionToRole(workspaceId, roleId, permissionId);
        cache.invalidate(workspaceId, roleId);
    }

    @Override
    public void removePermissionFromRole(String workspaceId, String roleId, String permissionId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");
        Identifiers.requireNonBlank(permissionId, "permissionId");

        store.removePermissionFromRole(workspaceId, roleId, permissionId);
        cache.invalidate(workspaceId, roleId);
    }

    // ========================================================================
    // Permission mutations
    // ========================================================================

    @Override
    public void createPermission(Permission permission) {
        store.createPermission(permission);
    }

    @Override
    public void updatePermission(Permission permission) {
        requireEntity(permission, "permission");
        store.updatePermission(permission);
        cache.invalidateWorkspace(permission.workspaceId());
    }

    @Override
    public void deletePermission(String workspaceId, String permissionId) {
        store.deletePermission(workspaceId, permissionId);
        cache.invalidateWorkspace(workspaceId);
    }

    @Override
    public void addPermissionParent(String workspaceId, String permissionId, String parentPermissionId) {
        store.addPermissionParent(workspaceId, permissionId, parentPermissionId);
        cache.invalidateWorkspace(workspaceId);
    }

    @Override
    public void removePermissionParent(String workspaceId, String permissionId, String parentPermissionId) {
        store.removePermissionParent(workspaceId, permissionId, parentPermissionId);
        cache.invalidateWorkspace(workspaceId);
    }

    // ========================================================================
    // Cache control
    // ========================================================================

    @Override
    public void invalidate(String workspaceId, String roleId) {
        cache.invalidate(workspaceId, roleId);
    }

    @Override
    public void invalidateWorkspace(String workspaceId) {
        cache.invalidateWorkspace(workspaceId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public AuthorizationStore store() {
        return store;
    }

    private static List<String> asList(String... permissionIds) {
        return permissionIds == null ? List.of() : Arrays.asList(permissionIds);
    }

    private static void requireEntity(Object entity, String name) {
        if (entity == null) {
            throw new InvalidArgumentException(name + " cannot be null");
        }
    }
}
