package lattice.adapter.out.storage.memory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import lattice.core.model.CyclicInheritanceException;
import lattice.core.model.EntityAlreadyExistsException;
import lattice.core.model.EntityKey;
import lattice.core.model.EntityNotFoundException;
import lattice.core.model.EntityType;
import lattice.core.model.InvalidArgumentException;
import lattice.core.model.Permission;
import lattice.core.model.Role;
import lattice.core.port.out.AuthorizationStore;
import lattice.core.service.InheritanceCycleDetector;
import lattice.core.util.Identifiers;

/**
 * In-memory implementation of AuthorizationStore.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Deployments whose roles and permissions are seeded at startup</li>
 *   <li>Fallback when no persistent storage provider is available</li>
 * </ul>
 *
 * <p>Entities are held per workspace, in one map for roles and one for permissions,
 * so each inheritance graph is its own adjacency structure keyed by entity ID.
 *
 * <p>Thread-safety: a single read/write lock guards all state. Mutations hold the
 * write lock across validation and the write itself; reads hold the read lock.
 * Records are immutable, so returned values never expose internal state.
 */
public class InMemoryAuthorizationStore implements AuthorizationStore {

    private final Map<String, Workspace> workspaces = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private static final class Workspace {
        private final Map<String, Role> roles = new LinkedHashMap<>();
        private final Map<String, Permission> permissions = new LinkedHashMap<>();

        private List<String> roleParents(String roleId) {
            final var role = roles.get(roleId);
            return role != null ? role.parentIds() : List.of();
        }

        private List<String> permissionParents(String permissionId) {
            final var permission = permissions.get(permissionId);
            return permission != null ? permission.parentIds() : List.of();
        }
    }

    // ========================================================================
    // Roles
    // ========================================================================

    @Override
    public void createRole(Role role) {
        final var key = validateRole(role);
        write(() -> {
            final var workspace = workspace(key.workspaceId());
            if (workspace.roles.containsKey(key.id())) {
                throw new EntityAlreadyExistsException(EntityType.ROLE, key);
            }
            checkRoleReferences(workspace, role);
            checkRoleCycle(workspace, key, role.parentIds());
            workspaces.putIfAbsent(key.workspaceId(), workspace);
            workspace.roles.put(key.id(), role);
        });
    }

    @Override
    public Role getRole(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        return read(() -> requireRole(workspace(key.workspaceId()), key));
    }

    @Override
    public List<Role> getRoles(String workspaceId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        return read(() -> {
            final var workspace = workspaces.get(workspaceId);
            return workspace == null ? List.of() : List.copyOf(workspace.roles.values());
        });
    }

    @Override
    public boolean roleExists(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        return read(() -> {
            final var workspace = workspaces.get(key.workspaceId());
            return workspace != null && workspace.roles.containsKey(key.id());
        });
    }

    @Override
    public void updateRole(Role role) {
        final var key = validateRole(role);
        write(() -> {
            final var workspace = workspace(key.workspaceId());
            requireRole(workspace, key);
            checkRoleReferences(workspace, role);
            checkRoleCycle(workspace, key, role.parentIds());
            workspace.roles.put(key.id(), role);
        });
    }

    @Override
    public void deleteRole(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        write(() -> {
            final var workspace = workspace(key.workspaceId());
            requireRole(workspace, key);
            workspace.roles.remove(key.id());
            workspace.roles.replaceAll((id, role) -> role.hasParent(roleId) ? role.withoutParent(roleId) : role);
            releaseIfEmpty(key.workspaceId(), workspace);
        });
    }

    @Override
    public void addRoleParent(String workspaceId, String roleId, String parentRoleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        final var parentKey = EntityKey.of(workspaceId, parentRoleId);
        write(() -> {
            final var workspace = workspace(workspaceId);
            final var role = requireRole(workspace, key);
            requireRole(workspace, parentKey);
            if (role.hasParent(parentRoleId)) {
                return;
            }
            checkRoleCycle(workspace, key, List.of(parentRoleId));
            workspace.roles.put(roleId, role.withParent(parentRoleId));
        });
    }

    @Override
    public void removeRoleParent(String workspaceId, String roleId, String parentRoleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        Identifiers.requireNonBlank(parentRoleId, "parentRoleId");
        write(() -> {
            final var workspace = workspace(workspaceId);
            final var role = requireRole(workspace, key);
            if (role.hasParent(parentRoleId)) {
                workspace.roles.put(roleId, role.withoutParent(parentRoleId));
            }
        });
    }

    @Override
    public List<Role> getRoleParents(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        return read(() -> {
            final var workspace = workspace(workspaceId);
            return requireRole(workspace, key).parentIds().stream()
                    .map(workspace.roles::get)
                    .filter(Objects::nonNull)
                    .toList();
        });
    }

    @Override
    public List<Role> getRoleChildren(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        return read(() -> {
            final var workspace = workspace(workspaceId);
            requireRole(workspace, key);
            return workspace.roles.values().stream()
                    .filter(role -> role.hasParent(roleId))
                    .toList();
        });
    }

    @Override
    public void addPermissionToRole(String workspaceId, String roleId, String permissionId) {
        final var key = EntityKey.of(workspaceId, roleId);
        final var permissionKey = EntityKey.of(workspaceId, permissionId);
        write(() -> {
            final var workspace = workspace(workspaceId);
            final var role = requireRole(workspace, key);
            requirePermission(workspace, permissionKey);
            if (!role.hasDirectPermission(permissionId)) {
                workspace.roles.put(roleId, role.withDirectPermission(permissionId));
            }
        });
    }

    @Override
    public void removePermissionFromRole(String workspaceId, String roleId, String permissionId) {
        final var key = EntityKey.of(workspaceId, roleId);
        Identifiers.requireNonBlank(permissionId, "permissionId");
        write(() -> {
            final var workspace = workspace(workspaceId);
            final var role = requireRole(workspace, key);
            if (role.hasDirectPermission(permissionId)) {
                workspace.roles.put(roleId, role.withoutDirectPermission(permissionId));
            }
        });
    }

    @Override
    public List<Permission> getRolePermissions(String workspaceId, String roleId) {
        final var key = EntityKey.of(workspaceId, roleId);
        return read(() -> {
            final var workspace = workspace(workspaceId);
            return requireRole(workspace, key).directPermissionIds().stream()
                    .map(workspace.permissions::get)
                    .filter(Objects::nonNull)
                    .toList();
        });
    }

    // ========================================================================
    // Permissions
    // ========================================================================

    @Override
    public void createPermission(Permission permission) {
        final var key = validatePermission(permission);
        write(() -> {
            final var workspace = workspace(key.workspaceId());
            if (workspace.permissions.containsKey(key.id())) {
                throw new EntityAlreadyExistsException(EntityType.PERMISSION, key);
            }
            requirePermissions(workspace, key.workspaceId(), permission.parentIds());
            checkPermissionCycle(workspace, key, permission.parentIds());
            workspaces.putIfAbsent(key.workspaceId(), workspace);
            workspace.permissions.put(key.id(), permission);
        });
    }

    @Override
    public Permission getPermission(String workspaceId, String permissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        return read(() -> requirePermission(workspace(workspaceId), key));
    }

    @Override
    public List<Permission> getPermissions(String workspaceId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        return read(() -> {
            final var workspace = workspaces.get(workspaceId);
            return workspace == null ? List.of() : List.copyOf(workspace.permissions.values());
        });
    }

    @Override
    public boolean permissionExists(String workspaceId, String permissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        return read(() -> {
            final var workspace = workspaces.get(key.workspaceId());
            return workspace != null && workspace.permissions.containsKey(key.id());
        });
    }

    @Override
    public void updatePermission(Permission permission) {
        final var key = validatePermission(permission);
        write(() -> {
            final var workspace = workspace(key.workspaceId());
            requirePermission(workspace, key);
            requirePermissions(workspace, key.workspaceId(), permission.parentIds());
            checkPermissionCycle(workspace, key, permission.parentIds());
            workspace.permissions.put(key.id(), permission);
        });
    }

    @Override
    public void deletePermission(String workspaceId, String permissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        write(() -> {
            final var workspace = workspace(workspaceId);
            requirePermission(workspace, key);
            workspace.permissions.remove(permissionId);
            workspace.permissions.replaceAll((id, permission) ->
                    permission.hasParent(permissionId) ? permission.withoutParent(permissionId) : permission);
            workspace.roles.replaceAll((id, role) ->
                    role.hasDirectPermission(permissionId) ? role.withoutDirectPermission(permissionId) : role);
            releaseIfEmpty(key.workspaceId(), workspace);
        });
    }

    @Override
    public void addPermissionParent(String workspaceId, String permissionId, String parentPermissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        final var parentKey = EntityKey.of(workspaceId, parentPermissionId);
        write(() -> {
            final var workspace = workspace(workspaceId);
            final var permission = requirePermission(workspace, key);
            requirePermission(workspace, parentKey);
            if (permission.hasParent(parentPermissionId)) {
                return;
            }
            checkPermissionCycle(workspace, key, List.of(parentPermissionId));
            workspace.permissions.put(permissionId, permission.withParent(parentPermissionId));
        });
    }

    @Override
    public void removePermissionParent(String workspaceId, String permissionId, String parentPermissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        Identifiers.requireNonBlank(parentPermissionId, "parentPermissionId");
        write(() -> {
            final var workspace = workspace(workspaceId);
            final var permission = requirePermission(workspace, key);
            if (permission.hasParent(parentPermissionId)) {
                workspace.permissions.put(permissionId, permission.withoutParent(parentPermissionId));
            }
        });
    }

    @Override
    public List<Permission> getPermissionParents(String workspaceId, String permissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        return read(() -> {
            final var workspace = workspace(workspaceId);
            return requirePermission(workspace, key).parentIds().stream()
                    .map(workspace.permissions::get)
                    .filter(Objects::nonNull)
                    .toList();
        });
    }

    @Override
    public List<Permission> getPermissionChildren(String workspaceId, String permissionId) {
        final var key = EntityKey.of(workspaceId, permissionId);
        return read(() -> {
            final var workspace = workspace(workspaceId);
            requirePermission(workspace, key);
            return workspace.permissions.values().stream()
                    .filter(permission -> permission.hasParent(permissionId))
                    .toList();
        });
    }

    // ========================================================================
    // Validation helpers (callers hold the lock where state is read)
    // ========================================================================

    private static EntityKey validateRole(Role role) {
        if (role == null) {
            throw new InvalidArgumentException("role cannot be null");
        }
        final var key = EntityKey.of(role.workspaceId(), role.id());
        Identifiers.requireNonBlank(role.name(), "role name");
        Identifiers.requireAllNonBlank(role.parentIds(), "parentIds");
        Identifiers.requireAllNonBlank(role.directPermissionIds(), "directPermissionIds");
        return key;
    }

    private static EntityKey validatePermission(Permission permission) {
        if (permission == null) {
            throw new InvalidArgumentException("permission cannot be null");
        }
        final var key = EntityKey.of(permission.workspaceId(), permission.id());
        Identifiers.requireNonBlank(permission.name(), "permission name");
        Identifiers.requireAllNonBlank(permission.parentIds(), "parentIds");
        return key;
    }

    /**
     * The workspace's data, or an empty placeholder that is registered only once written to.
     */
    private Workspace workspace(String workspaceId) {
        final var workspace = workspaces.get(workspaceId);
        return workspace != null ? workspace : new Workspace();
    }

    private void releaseIfEmpty(String workspaceId, Workspace workspace) {
        if (workspace.roles.isEmpty() && workspace.permissions.isEmpty()) {
            workspaces.remove(workspaceId);
        }
    }

    /**
     * Number of workspaces currently holding at least one entity.
     */
    int workspaceCount() {
        return read(workspaces::size);
    }

    private static Role requireRole(Workspace workspace, EntityKey key) {
        final var role = workspace.roles.get(key.id());
        if (role == null) {
            throw new EntityNotFoundException(EntityType.ROLE, key);
        }
        return role;
    }

    private static Permission requirePermission(Workspace workspace, EntityKey key) {
        final var permission = workspace.permissions.get(key.id());
        if (permission == null) {
            throw new EntityNotFoundException(EntityType.PERMISSION, key);
        }
        return permission;
    }

    private static void requirePermissions(Workspace workspace, String workspaceId, Collection<String> ids) {
        for (final var id : ids) {
            requirePermission(workspace, EntityKey.of(workspaceId, id));
        }
    }

    private static void checkRoleReferences(Workspace workspace, Role role) {
        for (final var parentId : role.parentIds()) {
            requireRole(workspace, EntityKey.of(role.workspaceId(), parentId));
        }
        requirePermissions(workspace, role.workspaceId(), role.directPermissionIds());
    }

    private static void checkRoleCycle(Workspace workspace, EntityKey key, List<String> parentIds) {
        InheritanceCycleDetector.findCyclicParent(key.id(), parentIds, workspace::roleParents)
                .ifPresent(parentId -> {
                    throw new CyclicInheritanceException(EntityType.ROLE, key, parentId);
                });
    }

    private static void checkPermissionCycle(Workspace workspace, EntityKey key, List<String> parentIds) {
        InheritanceCycleDetector.findCyclicParent(key.id(), parentIds, workspace::permissionParents)
                .ifPresent(parentId -> {
                    throw new CyclicInheritanceException(EntityType.PERMISSION, key, parentId);
                });
    }

    // ========================================================================
    // Locking
    // ========================================================================

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
