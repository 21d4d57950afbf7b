package lattice.core.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import lattice.core.model.Role;
import lattice.core.port.out.AuthorizationStore;
import lattice.core.util.Identifiers;

/**
 * Computes the effective permission IDs of a role.
 *
 * <p>The effective set is the union, over the role and every role it inherits from
 * transitively, of each role's direct permissions together with all of their
 * ancestors in the permission hierarchy.
 *
 * <p>Resolution is read-only and re-reads the store on every call. Each role in the
 * role closure is visited once. Each directly granted permission is expanded with its
 * own visited set, so a shared ancestor reached from two branches still contributes.
 */
@ApplicationScoped
public class EffectivePermissionResolver {

    private final AuthorizationStore store;

    @Inject
    public EffectivePermissionResolver(AuthorizationStore store) {
        this.store = store;
    }

    /**
     * Resolve the effective permission IDs of a role.
     *
     * @param workspaceId the workspace
     * @param roleId      the role
     * @return unmodifiable set of permission IDs
     * @throws lattice.core.model.InvalidArgumentException if either argument is blank
     * @throws lattice.core.model.EntityNotFoundException  if the role or an inherited entity is missing
     */
    public Set<String> resolve(String workspaceId, String roleId) {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(roleId, "roleId");

        final Set<String> grantedIds = new HashSet<>();
        for (final var role : roleClosure(workspaceId, roleId)) {
            grantedIds.addAll(role.directPermissionIds());
        }

        final Set<String> effective = new HashSet<>(grantedIds);
        for (final var permissionId : grantedIds) {
            collectPermissionAncestors(workspaceId, permissionId, effective);
        }
        return Set.copyOf(effective);
    }

    /**
     * The role itself followed by every role it inherits from, each exactly once.
     */
    private List<Role> roleClosure(String workspaceId, String roleId) {
        final var root = store.getRole(workspaceId, roleId);
        final Set<String> visited = new HashSet<>();
        visited.add(root.id());

        final var closure = new ArrayList<Role>();
        final var pending = new ArrayDeque<Role>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final var role = pending.pop();
            closure.add(role);
            for (final var parentId : role.parentIds()) {
                if (visited.add(parentId)) {
                    pending.push(store.getRole(workspaceId, parentId));
                }
            }
        }
        return closure;
    }

    private void collectPermissionAncestors(String workspaceId, String permissionId, Set<String> into) {
        final Set<String> visited = new HashSet<>();
        final var pending = new ArrayDeque<String>();
        pending.push(permissionId);
        visited.add(permissionId);

        while (!pending.isEmpty()) {
            final var permission = store.getPermission(workspaceId, pending.pop());
            for (final var parentId : permission.parentIds()) {
                into.add(parentId);
                if (visited.add(parentId)) {
                    pending.push(parentId);
                }
            }
        }
    }
}
